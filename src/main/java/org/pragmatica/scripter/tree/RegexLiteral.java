package org.pragmatica.scripter.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Regular expression literal, {@code /body/flags}.
 */
public final class RegexLiteral extends CodeNode implements Expression {
    private String body;
    private final List<String> flags;

    public RegexLiteral(String body, List<String> flags) {
        this.body = body;
        this.flags = flags;
    }

    /**
     * Split a literal such as {@code /a+b/gi} into body and flags.
     */
    public static RegexLiteral fromToken(String token) {
        int lastSlash = token.lastIndexOf('/');
        if (!token.startsWith("/") || lastSlash <= 0) {
            throw new IllegalArgumentException("Not a regular expression literal: " + token);
        }
        var flags = new ArrayList<String>();
        for (var flag : token.substring(lastSlash + 1).toCharArray()) {
            flags.add(String.valueOf(flag));
        }
        return new RegexLiteral(token.substring(1, lastSlash), flags);
    }

    public String body() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public List<String> flags() {
        return flags;
    }

    @Override
    protected String buildString() {
        return "/" + body + "/" + String.join("", flags);
    }
}
