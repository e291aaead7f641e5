package org.pragmatica.scripter.tree;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Shared mapper. Reading accepts TypeScript literal tokens as {@link AtomicValue} sees them:
 * single quoted strings, {@code NaN}/{@code Infinity} and escapes such as {@code \'}.
 */
final class Json {
    static final ObjectMapper MAPPER = JsonMapper.builder()
                                                 .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                                                 .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                                                 .enable(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER)
                                                 .build();

    private Json() {}
}
