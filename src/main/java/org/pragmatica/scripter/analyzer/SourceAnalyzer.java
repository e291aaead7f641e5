package org.pragmatica.scripter.analyzer;

import org.pragmatica.scripter.error.AnalysisError;
import org.pragmatica.scripter.error.AnalysisException;
import org.pragmatica.scripter.error.Diagnostic;
import org.pragmatica.scripter.syntax.Role;
import org.pragmatica.scripter.syntax.SourceFile;
import org.pragmatica.scripter.syntax.SyntaxElement;
import org.pragmatica.scripter.syntax.SyntaxKind;
import org.pragmatica.scripter.tree.ArrayBinding;
import org.pragmatica.scripter.tree.ArrayLiteral;
import org.pragmatica.scripter.tree.ArrayType;
import org.pragmatica.scripter.tree.AtomicValue;
import org.pragmatica.scripter.tree.BinaryOperation;
import org.pragmatica.scripter.tree.BindingElement;
import org.pragmatica.scripter.tree.BindingEntry;
import org.pragmatica.scripter.tree.BindingTarget;
import org.pragmatica.scripter.tree.Block;
import org.pragmatica.scripter.tree.Call;
import org.pragmatica.scripter.tree.CallableSignature;
import org.pragmatica.scripter.tree.CallableType;
import org.pragmatica.scripter.tree.Case;
import org.pragmatica.scripter.tree.ClassDeclaration;
import org.pragmatica.scripter.tree.CodeBlock;
import org.pragmatica.scripter.tree.CodeNode;
import org.pragmatica.scripter.tree.ComputedPropertyName;
import org.pragmatica.scripter.tree.DeclarationName;
import org.pragmatica.scripter.tree.ElementAccess;
import org.pragmatica.scripter.tree.ElementName;
import org.pragmatica.scripter.tree.EmptyExpression;
import org.pragmatica.scripter.tree.EnumDeclaration;
import org.pragmatica.scripter.tree.EnumMember;
import org.pragmatica.scripter.tree.ExportAssignment;
import org.pragmatica.scripter.tree.ExportDeclaration;
import org.pragmatica.scripter.tree.Expression;
import org.pragmatica.scripter.tree.For;
import org.pragmatica.scripter.tree.ForInOf;
import org.pragmatica.scripter.tree.FunctionDeclaration;
import org.pragmatica.scripter.tree.Identifier;
import org.pragmatica.scripter.tree.If;
import org.pragmatica.scripter.tree.ImportBinding;
import org.pragmatica.scripter.tree.ImportDeclaration;
import org.pragmatica.scripter.tree.ImportSpecifier;
import org.pragmatica.scripter.tree.IndexSignature;
import org.pragmatica.scripter.tree.InterfaceDeclaration;
import org.pragmatica.scripter.tree.InternalModuleImport;
import org.pragmatica.scripter.tree.Keyword;
import org.pragmatica.scripter.tree.KeywordOperator;
import org.pragmatica.scripter.tree.KeywordType;
import org.pragmatica.scripter.tree.LabeledStatement;
import org.pragmatica.scripter.tree.Lambda;
import org.pragmatica.scripter.tree.Loop;
import org.pragmatica.scripter.tree.ModuleDeclaration;
import org.pragmatica.scripter.tree.ModuleName;
import org.pragmatica.scripter.tree.NamedImports;
import org.pragmatica.scripter.tree.NamespaceBinding;
import org.pragmatica.scripter.tree.New;
import org.pragmatica.scripter.tree.ObjectBinding;
import org.pragmatica.scripter.tree.ObjectLiteral;
import org.pragmatica.scripter.tree.ObjectLiteralProperty;
import org.pragmatica.scripter.tree.Opaque;
import org.pragmatica.scripter.tree.ParenthesizedType;
import org.pragmatica.scripter.tree.Parenthetical;
import org.pragmatica.scripter.tree.Property;
import org.pragmatica.scripter.tree.PropertyAccess;
import org.pragmatica.scripter.tree.PropertyType;
import org.pragmatica.scripter.tree.QualifiedName;
import org.pragmatica.scripter.tree.QualifiedTypeName;
import org.pragmatica.scripter.tree.RegexLiteral;
import org.pragmatica.scripter.tree.RequireImport;
import org.pragmatica.scripter.tree.SimpleImport;
import org.pragmatica.scripter.tree.Source;
import org.pragmatica.scripter.tree.Switch;
import org.pragmatica.scripter.tree.TaggedTemplate;
import org.pragmatica.scripter.tree.TemplateLiteralPiece;
import org.pragmatica.scripter.tree.TemplatePart;
import org.pragmatica.scripter.tree.TemplatePattern;
import org.pragmatica.scripter.tree.TernaryOperation;
import org.pragmatica.scripter.tree.Trivia;
import org.pragmatica.scripter.tree.Try;
import org.pragmatica.scripter.tree.TupleType;
import org.pragmatica.scripter.tree.TypeAlias;
import org.pragmatica.scripter.tree.TypeAssertion;
import org.pragmatica.scripter.tree.TypeLiteral;
import org.pragmatica.scripter.tree.TypeNode;
import org.pragmatica.scripter.tree.TypeOf;
import org.pragmatica.scripter.tree.TypeParameter;
import org.pragmatica.scripter.tree.UnaryOperation;
import org.pragmatica.scripter.tree.UnionType;
import org.pragmatica.scripter.tree.VariableDeclaration;
import org.pragmatica.scripter.tree.With;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Translates the parse tree of one file into an editable {@link Source} tree.
 *
 * <p>Every element appended to a block is preceded by a {@link Trivia} holding the whitespace
 * and comments in front of it, and every translated node starts with the literal source text
 * of its element, so an unedited tree renders the file byte for byte.
 *
 * <p>Without {@link AnalyzerConfig#recursive()} only the blocks that are analyzed directly
 * receive elements; nested blocks stay empty until passed to {@link #analyzeBody(Block)}.
 * Analysis of a block that already has a body is a no-op.
 *
 * <p>The analyzer keeps no state of its own between calls; any number of instances may be
 * created for the same file and root.
 */
public final class SourceAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(SourceAnalyzer.class);

    private final SourceFile sourceFile;
    private final Source source;
    private final AnalyzerConfig config;

    public SourceAnalyzer(SourceFile sourceFile, Source source, AnalyzerConfig config) {
        this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
        this.source = Objects.requireNonNull(source, "source");
        this.config = Objects.requireNonNull(config, "config");
    }

    public SourceFile sourceFile() {
        return sourceFile;
    }

    public Source source() {
        return source;
    }

    public AnalyzerConfig config() {
        return config;
    }

    /**
     * Fill the root with the top level statements of the file.
     *
     * <p>When the root was analyzed before, a recursive analyzer expands every block that is
     * still pending and a shallow one does nothing.
     *
     * @throws AnalysisException in strict mode, for the first element without a translation
     *                           rule; the root is then left unanalyzed
     */
    public Source analyze() {
        var root = sourceFile.root();
        source.registerWithElement(root);

        if (source.canAnalyzeBody()) {
            performBlockAnalysis(source, root, root.children(Role.STATEMENTS), this::moduleElement, false);
            source.setText(withTrailingNewline(sourceFile.text()));
            LOG.debug("Analyzed {}: {} top level elements", sourceFile.fileName(), source.elements().size());
        } else if (config.recursive()) {
            expandPending(source);
        }
        return source;
    }

    /**
     * Fill a block that was produced by this analyzer, or by another one over the same file.
     *
     * @throws AnalysisException        when the block lost its origin element, or in strict mode
     *                                  when one of its elements cannot be translated
     * @throws IllegalArgumentException for block kinds the analyzer never produces
     */
    public <T extends Block> T analyzeBody(T block) {
        if (block == source) {
            analyze();
            return block;
        }

        var origin = block.origin()
                          .orElseThrow(() -> missingOrigin(block));

        if (block instanceof EnumDeclaration enumeration) {
            enumBody(enumeration, origin);
        } else if (block instanceof InterfaceDeclaration declaration) {
            interfaceBody(declaration, origin);
        } else if (block instanceof ModuleDeclaration module) {
            moduleBody(module, origin);
        } else if (block instanceof FunctionDeclaration function) {
            functionBody(function, origin);
        } else if (block instanceof Lambda lambda) {
            lambdaBody(lambda, origin);
        } else if (block instanceof ClassDeclaration declaration) {
            classBody(declaration, origin);
        } else if (block instanceof Case clause) {
            caseBody(clause, origin);
        } else if (block instanceof Switch statement) {
            switchBody(statement, origin);
        } else if (block instanceof ObjectLiteral literal) {
            objectLiteralBody(literal, origin);
        } else if (block instanceof VariableDeclaration declaration) {
            variableDeclarationBody(declaration, origin);
        } else if (block instanceof CodeBlock codeBlock) {
            codeBlockBody(codeBlock, origin);
        } else if (block instanceof ArrayLiteral literal) {
            arrayLiteralBody(literal, origin);
        } else if (block instanceof TypeLiteral literal) {
            typeLiteralBody(literal, origin);
        } else {
            throw new IllegalArgumentException("Cannot analyze block of type " + block.getClass().getSimpleName());
        }
        return block;
    }

    private void expandPending(Source root) {
        root.walkChildren(node -> {
            if (node instanceof Block block && block.canAnalyzeBody() && block.origin().isPresent()) {
                analyzeBody(block);
            }
        });
    }

    // === Block filling ===

    private <B extends Block> B performBlockAnalysis(B block,
                                                    SyntaxElement owner,
                                                    List<SyntaxElement> elements,
                                                    Function<SyntaxElement, CodeNode> rule,
                                                    boolean ignoreTrailing) {
        if (!block.canAnalyzeBody()) {
            return block;
        }

        var analyzed = new ArrayList<CodeNode>();
        for (var element : elements) {
            var node = translate(element, rule);
            addTrivia(analyzed, element.leadingTrivia());
            node.setText(elementText(node, element));
            analyzed.add(node);
        }

        if (!ignoreTrailing) {
            var last = elements.isEmpty() ? null : elements.get(elements.size() - 1);
            owner.child(Role.CLOSE_TOKEN)
                 .filter(close -> close != last)
                 .ifPresent(close -> addTrivia(analyzed, close.leadingTrivia()));
        }

        block.completeBody(analyzed);
        return block;
    }

    private CodeNode translate(SyntaxElement element, Function<SyntaxElement, CodeNode> rule) {
        try {
            return rule.apply(element);
        } catch (AnalysisException e) {
            if (config.isStrict() || !e.isRecoverable()) {
                throw e;
            }
            var error = (AnalysisError.UnsupportedConstruct) e.error();
            LOG.warn("Keeping {} as literal text\n{}",
                     error.kind(),
                     Diagnostic.fallback(error).format(sourceFile.text(), sourceFile.fileName()));

            var fallback = new Opaque();
            fallback.registerWithElement(element);
            return fallback;
        }
    }

    private static void addTrivia(List<CodeNode> analyzed, String trivia) {
        if (!trivia.isEmpty()) {
            analyzed.add(new Trivia(trivia));
        }
    }

    /**
     * Element text without the trailing semicolon the block appends again as terminator.
     */
    private static String elementText(CodeNode node, SyntaxElement element) {
        var text = element.text();
        if (text.endsWith(";") && ";".equals(node.statementTerminator())) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }

    private static String withTrailingNewline(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }

    // === Module level ===

    private CodeNode moduleElement(SyntaxElement e) {
        return switch (e.kind()) {
            case IMPORT_EQUALS_DECLARATION -> importEquals(e);
            case MODULE_DECLARATION -> moduleDeclaration(e);
            case IMPORT_DECLARATION -> importDeclaration(e);
            default -> statement(e);
        };
    }

    private ModuleDeclaration moduleDeclaration(SyntaxElement e) {
        var result = register(new ModuleDeclaration(moduleName(e), modifiers(e)), e);
        if (config.recursive()) {
            moduleBody(result, e);
        }
        return result;
    }

    private ModuleName moduleName(SyntaxElement e) {
        var first = required(e, Role.NAME);
        if (isLiteral(first)) {
            return atomic(first);
        }

        int base = offset(e);
        int firstStart = offset(first);
        QualifiedName name = null;

        for (var current = e; current != null && current.is(SyntaxKind.MODULE_DECLARATION); ) {
            var segment = required(current, Role.NAME);
            name = new QualifiedName(identifierName(segment), name);
            name.registerWithElement(current);
            name.setText(e.text().substring(firstStart - base, segment.span().end().offset() - base));
            current = current.child(Role.BODY).orElse(null);
        }
        return name;
    }

    private void moduleBody(ModuleDeclaration module, SyntaxElement e) {
        var body = e.child(Role.BODY).orElse(null);
        while (body != null && body.is(SyntaxKind.MODULE_DECLARATION)) {
            body = body.child(Role.BODY).orElse(null);
        }

        if (body == null) {
            module.completeBody(List.of());
            return;
        }
        if (!body.is(SyntaxKind.MODULE_BLOCK)) {
            throw unsupported(body, "module body");
        }
        performBlockAnalysis(module, body, body.children(Role.STATEMENTS), this::moduleElement, false);
    }

    private CodeNode importEquals(SyntaxElement e) {
        var reference = required(e, Role.MODULE_REFERENCE);

        CodeNode result = switch (reference.kind()) {
            case EXTERNAL_MODULE_REFERENCE -> new RequireImport(identifier(required(e, Role.NAME)),
                                                                expression(required(reference, Role.EXPRESSION)),
                                                                modifiers(e));
            case QUALIFIED_NAME, IDENTIFIER -> new InternalModuleImport(identifierName(required(e, Role.NAME)),
                                                                        entityName(reference),
                                                                        modifiers(e));
            default -> throw unsupported(reference, "module reference");
        };
        return register(result, e);
    }

    private CodeNode importDeclaration(SyntaxElement e) {
        var modulePath = expression(required(e, Role.MODULE_SPECIFIER));
        var clause = e.child(Role.IMPORT_CLAUSE);

        if (clause.isEmpty()) {
            return register(new SimpleImport(modulePath), e);
        }

        var defaultBinding = clause.get().child(Role.NAME).map(this::identifier).orElse(null);
        var namedBindings = clause.get().child(Role.NAMED_BINDINGS).map(this::importBinding).orElse(null);
        return register(new ImportDeclaration(modulePath, defaultBinding, namedBindings, modifiers(e)), e);
    }

    private ImportBinding importBinding(SyntaxElement e) {
        return switch (e.kind()) {
            case NAMESPACE_IMPORT -> register(new NamespaceBinding(identifier(required(e, Role.NAME))), e);
            case NAMED_IMPORTS -> namedImports(e);
            default -> throw unsupported(e, "import named bindings");
        };
    }

    private NamedImports namedImports(SyntaxElement e) {
        var specifiers = new ArrayList<ImportSpecifier>();
        for (var specifier : e.children(Role.ELEMENTS)) {
            var name = identifier(required(specifier, Role.NAME));
            var result = specifier.child(Role.PROPERTY_NAME)
                                  .map(property -> new ImportSpecifier(identifier(property), name))
                                  .orElseGet(() -> new ImportSpecifier(name));
            specifiers.add(register(result, specifier));
        }
        return register(new NamedImports(specifiers), e);
    }

    // === Declarations ===

    private ClassDeclaration classDeclaration(SyntaxElement e) {
        QualifiedTypeName parentClass = null;
        var interfaces = new ArrayList<QualifiedTypeName>();

        for (var clause : e.children(Role.HERITAGE_CLAUSES)) {
            var types = heritageTypes(clause);
            var keyword = required(clause, Role.KEYWORD);

            if (keyword.is(SyntaxKind.IMPLEMENTS_KEYWORD)) {
                for (var type : types) {
                    interfaces.add(heritage(type));
                }
            } else if (keyword.is(SyntaxKind.EXTENDS_KEYWORD)) {
                parentClass = heritage(types.get(0));
            } else {
                throw unsupported(clause, "heritage clause");
            }
        }

        var result = new ClassDeclaration(identifierName(required(e, Role.NAME)),
                                          modifiers(e),
                                          parentClass,
                                          typeParameters(e),
                                          interfaces,
                                          decorators(e));
        register(result, e);
        if (config.recursive()) {
            classBody(result, e);
        }
        return result;
    }

    private void classBody(ClassDeclaration declaration, SyntaxElement e) {
        performBlockAnalysis(declaration, e, e.children(Role.MEMBERS), this::classElement, false);
    }

    private CodeNode classElement(SyntaxElement e) {
        return switch (e.kind()) {
            case PROPERTY_DECLARATION, INDEX_SIGNATURE -> member(e);
            case CONSTRUCTOR -> function(e, true, keywordName("constructor", e));
            case METHOD_DECLARATION -> function(e, true, null);
            case GET_ACCESSOR -> accessor(e, "get");
            case SET_ACCESSOR -> accessor(e, "set");
            case SEMICOLON_CLASS_ELEMENT -> {
                var empty = register(new EmptyExpression(), e);
                empty.setText("");
                yield empty;
            }
            default -> throw unsupported(e, "class element");
        };
    }

    private InterfaceDeclaration interfaceDeclaration(SyntaxElement e) {
        var extended = new ArrayList<QualifiedTypeName>();

        for (var clause : e.children(Role.HERITAGE_CLAUSES)) {
            var types = heritageTypes(clause);
            if (!required(clause, Role.KEYWORD).is(SyntaxKind.EXTENDS_KEYWORD)) {
                throw unsupported(clause, "interface heritage clause");
            }
            for (var type : types) {
                extended.add(heritage(type));
            }
        }

        var result = new InterfaceDeclaration(identifierName(required(e, Role.NAME)),
                                              typeParameters(e),
                                              extended,
                                              modifiers(e));
        register(result, e);
        if (config.recursive()) {
            interfaceBody(result, e);
        }
        return result;
    }

    private void interfaceBody(InterfaceDeclaration declaration, SyntaxElement e) {
        performBlockAnalysis(declaration, e, e.children(Role.MEMBERS), this::member, false);
    }

    private List<SyntaxElement> heritageTypes(SyntaxElement clause) {
        var types = clause.children(Role.TYPES);
        if (types.isEmpty()) {
            throw malformed(clause, Role.TYPES);
        }
        return types;
    }

    private QualifiedTypeName heritage(SyntaxElement e) {
        var result = new QualifiedTypeName(qualifiedNameLike(required(e, Role.EXPRESSION)),
                                           types(e.children(Role.TYPE_ARGUMENTS)));
        return register(result, e);
    }

    private QualifiedName qualifiedNameLike(SyntaxElement e) {
        var result = switch (e.kind()) {
            case PROPERTY_ACCESS_EXPRESSION -> new QualifiedName(identifierName(required(e, Role.NAME)),
                                                                 qualifiedNameLike(required(e, Role.EXPRESSION)));
            case IDENTIFIER -> new QualifiedName(e.text());
            default -> throw unsupported(e, "heritage type");
        };
        return register(result, e);
    }

    private EnumDeclaration enumDeclaration(SyntaxElement e) {
        var result = register(new EnumDeclaration(identifierName(required(e, Role.NAME)), modifiers(e)), e);
        if (config.recursive()) {
            enumBody(result, e);
        }
        return result;
    }

    private void enumBody(EnumDeclaration declaration, SyntaxElement e) {
        performBlockAnalysis(declaration, e, e.children(Role.MEMBERS), this::enumMember, false);
    }

    private CodeNode enumMember(SyntaxElement e) {
        if (!e.is(SyntaxKind.ENUM_MEMBER)) {
            throw unsupported(e, "enum member");
        }
        var result = new EnumMember(elementName(required(e, Role.NAME)), optionalExpression(e, Role.INITIALIZER));
        return register(result, e);
    }

    private TypeAlias typeAlias(SyntaxElement e) {
        var result = new TypeAlias(identifierName(required(e, Role.NAME)), type(required(e, Role.TYPE)), modifiers(e));
        return register(result, e);
    }

    // === Functions ===

    private FunctionDeclaration function(SyntaxElement e, boolean method, Identifier keywordName) {
        var signature = callableSignature(e, keywordName);
        // the element text covers the body, so the signature renders from its parts
        signature.markDirty();

        var result = new FunctionDeclaration(signature, modifiers(e), method, !e.has(Role.BODY), decorators(e));
        register(result, e);
        if (config.recursive()) {
            functionBody(result, e);
        }
        return result;
    }

    private FunctionDeclaration accessor(SyntaxElement e, String keyword) {
        var result = function(e, true, null);
        result.modifiers().add(keyword);
        return result;
    }

    private void functionBody(FunctionDeclaration function, SyntaxElement e) {
        var body = e.child(Role.BODY).orElse(null);
        if (body == null) {
            if (function.canAnalyzeBody()) {
                function.completeBody(List.of());
            }
            return;
        }
        if (!body.is(SyntaxKind.BLOCK)) {
            throw unsupported(body, "function body");
        }
        performBlockAnalysis(function, body, body.children(Role.STATEMENTS), this::statement, false);
    }

    private Lambda lambda(SyntaxElement e) {
        var signature = callableSignature(e, null);
        signature.markDirty();

        var body = required(e, Role.BODY);
        var result = new Lambda(signature, !body.is(SyntaxKind.BLOCK), !e.text().startsWith("("));
        register(result, e);
        if (config.recursive()) {
            lambdaBody(result, e);
        }
        return result;
    }

    private void lambdaBody(Lambda lambda, SyntaxElement e) {
        var body = required(e, Role.BODY);
        if (body.is(SyntaxKind.BLOCK)) {
            performBlockAnalysis(lambda, body, body.children(Role.STATEMENTS), this::statement, false);
        } else {
            performBlockAnalysis(lambda, e, List.of(body), this::expressionNode, true);
        }
    }

    private CallableSignature callableSignature(SyntaxElement e, Identifier keywordName) {
        var result = new CallableSignature(signatureName(e, keywordName),
                                           parameters(e),
                                           optionalType(e, Role.TYPE),
                                           typeParameters(e),
                                           e.has(Role.QUESTION_TOKEN));
        return register(result, e);
    }

    private CallableType callableType(SyntaxElement e, Identifier keywordName) {
        var result = new CallableType(signatureName(e, keywordName),
                                      parameters(e),
                                      optionalType(e, Role.TYPE),
                                      typeParameters(e),
                                      e.has(Role.QUESTION_TOKEN));
        return register(result, e);
    }

    private DeclarationName signatureName(SyntaxElement e, Identifier keywordName) {
        return e.child(Role.NAME).map(this::declarationName).orElse(keywordName);
    }

    private List<Property> parameters(SyntaxElement e) {
        var result = new ArrayList<Property>();
        for (var parameter : e.children(Role.PARAMETERS)) {
            result.add(property(parameter));
        }
        return result;
    }

    private List<TypeParameter> typeParameters(SyntaxElement e) {
        var result = new ArrayList<TypeParameter>();
        for (var declaration : e.children(Role.TYPE_PARAMETERS)) {
            var parameter = new TypeParameter(identifierName(required(declaration, Role.NAME)),
                                              optionalType(declaration, Role.CONSTRAINT));
            result.add(register(parameter, declaration));
        }
        return result;
    }

    private static Identifier keywordName(String keyword, SyntaxElement e) {
        var result = new Identifier(keyword);
        result.registerWithElement(e);
        result.setText(keyword);
        return result;
    }

    // === Members and properties ===

    private CodeNode member(SyntaxElement e) {
        return switch (e.kind()) {
            case INDEX_SIGNATURE -> {
                var parameter = required(e, Role.PARAMETERS);
                var index = new IndexSignature(identifierName(required(parameter, Role.NAME)),
                                               type(required(parameter, Role.TYPE)),
                                               type(required(e, Role.TYPE)));
                yield register(index, e);
            }
            case CONSTRUCT_SIGNATURE -> callableSignature(e, keywordName("new", e));
            case METHOD_SIGNATURE, CALL_SIGNATURE -> callableSignature(e, null);
            case VARIABLE_DECLARATION, PARAMETER, PROPERTY_SIGNATURE, PROPERTY_DECLARATION -> property(e);
            default -> throw unsupported(e, "property");
        };
    }

    private Property property(SyntaxElement e) {
        return switch (e.kind()) {
            case VARIABLE_DECLARATION, PARAMETER, PROPERTY_SIGNATURE, PROPERTY_DECLARATION -> {
                var result = new Property(declarationName(required(e, Role.NAME)),
                                          e.child(Role.TYPE).map(this::propertyType).orElse(null),
                                          optionalExpression(e, Role.INITIALIZER),
                                          modifiers(e),
                                          decorators(e),
                                          e.has(Role.QUESTION_TOKEN),
                                          e.has(Role.DOT_DOT_DOT_TOKEN));
                yield register(result, e);
            }
            default -> throw unsupported(e, "property");
        };
    }

    private PropertyType propertyType(SyntaxElement e) {
        return isLiteral(e) ? atomic(e) : type(e);
    }

    // === Names and bindings ===

    private DeclarationName declarationName(SyntaxElement e) {
        return switch (e.kind()) {
            case ARRAY_BINDING_PATTERN, OBJECT_BINDING_PATTERN -> bindingPattern(e);
            default -> elementName(e);
        };
    }

    private ElementName elementName(SyntaxElement e) {
        return switch (e.kind()) {
            case IDENTIFIER -> identifier(e);
            case COMPUTED_PROPERTY_NAME -> register(new ComputedPropertyName(expression(required(e, Role.EXPRESSION))), e);
            case NUMERIC_LITERAL, STRING_LITERAL, TRUE_KEYWORD, FALSE_KEYWORD, NULL_KEYWORD -> atomic(e);
            default -> throw unsupported(e, "declaration name");
        };
    }

    private BindingTarget bindingTarget(SyntaxElement e) {
        return switch (e.kind()) {
            case IDENTIFIER -> identifier(e);
            case ARRAY_BINDING_PATTERN, OBJECT_BINDING_PATTERN -> bindingPattern(e);
            default -> throw unsupported(e, "binding element name");
        };
    }

    private BindingTarget bindingPattern(SyntaxElement e) {
        var entries = new ArrayList<BindingEntry>();
        for (var element : e.children(Role.ELEMENTS)) {
            entries.add(bindingEntry(element));
        }

        return e.is(SyntaxKind.ARRAY_BINDING_PATTERN)
               ? register(new ArrayBinding(entries), e)
               : register(new ObjectBinding(entries), e);
    }

    private BindingEntry bindingEntry(SyntaxElement e) {
        if (e.is(SyntaxKind.OMITTED_EXPRESSION) || !e.has(Role.NAME)) {
            return register(new EmptyExpression(), e);
        }

        var result = new BindingElement(bindingTarget(required(e, Role.NAME)),
                                        e.child(Role.PROPERTY_NAME).map(this::elementName).orElse(null),
                                        e.has(Role.DOT_DOT_DOT_TOKEN),
                                        optionalExpression(e, Role.INITIALIZER));
        return register(result, e);
    }

    private QualifiedName entityName(SyntaxElement e) {
        var result = e.is(SyntaxKind.QUALIFIED_NAME)
                     ? new QualifiedName(identifierName(required(e, Role.RIGHT)), entityName(required(e, Role.LEFT)))
                     : new QualifiedName(identifierName(e));
        return register(result, e);
    }

    private Identifier identifier(SyntaxElement e) {
        return register(new Identifier(identifierName(e)), e);
    }

    private String identifierName(SyntaxElement e) {
        if (!e.is(SyntaxKind.IDENTIFIER)) {
            throw unsupported(e, "identifier");
        }
        return e.text();
    }

    // === Statements ===

    private CodeNode statement(SyntaxElement e) {
        return switch (e.kind()) {
            case BLOCK -> codeBlock(e);
            case EXPRESSION_STATEMENT -> expressionNode(required(e, Role.EXPRESSION));
            case VARIABLE_STATEMENT -> variableStatement(e);
            case FUNCTION_DECLARATION -> function(e, false, null);
            case SWITCH_STATEMENT -> switchStatement(e);
            case CLASS_DECLARATION -> classDeclaration(e);
            case INTERFACE_DECLARATION -> interfaceDeclaration(e);
            case ENUM_DECLARATION -> enumDeclaration(e);
            case TYPE_ALIAS_DECLARATION -> typeAlias(e);
            default -> register(simpleStatement(e), e);
        };
    }

    private CodeNode simpleStatement(SyntaxElement e) {
        return switch (e.kind()) {
            case LABELED_STATEMENT -> new LabeledStatement(identifier(required(e, Role.LABEL)),
                                                           statement(required(e, Role.STATEMENT)));
            case EXPORT_DECLARATION -> new ExportDeclaration(e.child(Role.EXPORT_CLAUSE).map(this::namedImports).orElse(null),
                                                             optionalExpression(e, Role.MODULE_SPECIFIER));
            case EXPORT_ASSIGNMENT -> new ExportAssignment(expression(required(e, Role.EXPRESSION)),
                                                           required(e, Role.KEYWORD).is(SyntaxKind.DEFAULT_KEYWORD));
            case WITH_STATEMENT -> new With(expression(required(e, Role.EXPRESSION)),
                                            statement(required(e, Role.STATEMENT)));
            case FOR_IN_STATEMENT, FOR_OF_STATEMENT -> new ForInOf(forInitializer(required(e, Role.INITIALIZER)),
                                                                   expression(required(e, Role.EXPRESSION)),
                                                                   statement(required(e, Role.STATEMENT)),
                                                                   e.is(SyntaxKind.FOR_OF_STATEMENT));
            case FOR_STATEMENT -> new For(e.child(Role.INITIALIZER).map(this::forInitializer).orElse(null),
                                          optionalExpression(e, Role.CONDITION),
                                          optionalExpression(e, Role.INCREMENTOR),
                                          statement(required(e, Role.STATEMENT)));
            case TRY_STATEMENT -> tryStatement(e);
            case THROW_STATEMENT -> UnaryOperation.throwing(expression(required(e, Role.EXPRESSION)));
            case RETURN_STATEMENT -> returnStatement(e);
            case BREAK_STATEMENT -> KeywordOperator.breaking(e.child(Role.LABEL).map(this::identifier).orElse(null));
            case CONTINUE_STATEMENT -> KeywordOperator.continuing(e.child(Role.LABEL).map(this::identifier).orElse(null));
            case DEBUGGER_STATEMENT -> new Keyword("debugger");
            case DO_STATEMENT, WHILE_STATEMENT -> new Loop(expression(required(e, Role.EXPRESSION)),
                                                           statement(required(e, Role.STATEMENT)),
                                                           e.is(SyntaxKind.DO_STATEMENT));
            case IF_STATEMENT -> new If(expression(required(e, Role.EXPRESSION)),
                                        statement(required(e, Role.THEN_STATEMENT)),
                                        e.child(Role.ELSE_STATEMENT).map(this::statement).orElse(null));
            case EMPTY_STATEMENT -> new EmptyExpression();
            default -> throw unsupported(e, "statement");
        };
    }

    private UnaryOperation returnStatement(SyntaxElement e) {
        var value = e.child(Role.EXPRESSION);
        if (value.isPresent()) {
            return UnaryOperation.returning(expression(value.get()));
        }

        var nothing = register(new Identifier(""), e);
        nothing.setText("");
        return new UnaryOperation("return", nothing, false);
    }

    private Try tryStatement(SyntaxElement e) {
        CodeBlock catchBlock = null;
        Identifier catchIdentifier = null;

        var clause = e.child(Role.CATCH_CLAUSE);
        if (clause.isPresent()) {
            catchIdentifier = clause.get()
                                    .child(Role.VARIABLE_DECLARATION)
                                    .map(declaration -> identifier(required(declaration, Role.NAME)))
                                    .orElse(null);
            catchBlock = codeBlock(required(clause.get(), Role.BLOCK));
        }

        return new Try(codeBlock(required(e, Role.TRY_BLOCK)),
                       catchBlock,
                       catchIdentifier,
                       e.child(Role.FINALLY_BLOCK).map(this::codeBlock).orElse(null));
    }

    private CodeNode forInitializer(SyntaxElement e) {
        return e.is(SyntaxKind.VARIABLE_DECLARATION_LIST)
               ? variableStatement(e)
               : expressionNode(e);
    }

    private CodeBlock codeBlock(SyntaxElement e) {
        var result = register(new CodeBlock(), e);
        if (config.recursive()) {
            codeBlockBody(result, e);
        }
        return result;
    }

    private void codeBlockBody(CodeBlock block, SyntaxElement e) {
        performBlockAnalysis(block, e, e.children(Role.STATEMENTS), this::statement, false);
    }

    /**
     * Variable statement, or the bare declaration list of a {@code for} initializer.
     */
    private VariableDeclaration variableStatement(SyntaxElement e) {
        var list = declarationList(e);
        var kind = switch (required(list, Role.KEYWORD).kind()) {
            case LET_KEYWORD -> VariableDeclaration.Kind.LET;
            case CONST_KEYWORD -> VariableDeclaration.Kind.CONST;
            default -> VariableDeclaration.Kind.VAR;
        };

        var result = register(new VariableDeclaration(modifiers(e), kind), e);
        if (config.recursive()) {
            variableDeclarationBody(result, e);
        }
        return result;
    }

    private void variableDeclarationBody(VariableDeclaration declaration, SyntaxElement e) {
        var list = declarationList(e);
        performBlockAnalysis(declaration, list, list.children(Role.DECLARATIONS), this::property, true);
    }

    private SyntaxElement declarationList(SyntaxElement e) {
        return e.is(SyntaxKind.VARIABLE_STATEMENT)
               ? required(e, Role.DECLARATION_LIST)
               : e;
    }

    private Switch switchStatement(SyntaxElement e) {
        var result = register(new Switch(expression(required(e, Role.EXPRESSION))), e);
        if (config.recursive()) {
            switchBody(result, e);
        }
        return result;
    }

    private void switchBody(Switch statement, SyntaxElement e) {
        var caseBlock = required(e, Role.CASE_BLOCK);
        performBlockAnalysis(statement, caseBlock, caseBlock.children(Role.CLAUSES), this::caseClause, false);
    }

    private Case caseClause(SyntaxElement e) {
        var result = switch (e.kind()) {
            case CASE_CLAUSE -> new Case(expression(required(e, Role.EXPRESSION)));
            case DEFAULT_CLAUSE -> new Case(null);
            default -> throw unsupported(e, "case clause");
        };
        register(result, e);
        if (config.recursive()) {
            caseBody(result, e);
        }
        return result;
    }

    private void caseBody(Case clause, SyntaxElement e) {
        performBlockAnalysis(clause, e, e.children(Role.STATEMENTS), this::statement, true);
    }

    // === Expressions ===

    private CodeNode expressionNode(SyntaxElement e) {
        return (CodeNode) expression(e);
    }

    private Expression optionalExpression(SyntaxElement e, Role role) {
        return e.child(role).map(this::expression).orElse(null);
    }

    private Expression expression(SyntaxElement e) {
        CodeNode result = switch (e.kind()) {
            case TAGGED_TEMPLATE_EXPRESSION -> taggedTemplate(e);
            case SPREAD_ELEMENT -> UnaryOperation.spread(expression(required(e, Role.EXPRESSION)));
            case OMITTED_EXPRESSION -> new EmptyExpression();
            case TYPE_ASSERTION_EXPRESSION -> new TypeAssertion(expression(required(e, Role.EXPRESSION)),
                                                                type(required(e, Role.TYPE)));
            case FUNCTION_EXPRESSION -> function(e, false, null);
            case ELEMENT_ACCESS_EXPRESSION -> new ElementAccess(expression(required(e, Role.EXPRESSION)),
                                                                expression(required(e, Role.ARGUMENT_EXPRESSION)));
            case NEW_EXPRESSION -> new New(call(e, true));
            case CALL_EXPRESSION -> call(e, false);
            case OBJECT_LITERAL_EXPRESSION -> objectLiteral(e);
            case ARRAY_LITERAL_EXPRESSION -> arrayLiteral(e);
            case IDENTIFIER, THIS_KEYWORD, SUPER_KEYWORD -> new Identifier(e.text());
            case TYPE_OF_EXPRESSION -> new TypeOf(expression(required(e, Role.EXPRESSION)));
            case DELETE_EXPRESSION -> UnaryOperation.delete(expression(required(e, Role.EXPRESSION)));
            case VOID_EXPRESSION -> KeywordOperator.voiding(expression(required(e, Role.EXPRESSION)));
            case ARROW_FUNCTION -> lambda(e);
            case NUMERIC_LITERAL, STRING_LITERAL, TRUE_KEYWORD, FALSE_KEYWORD, NULL_KEYWORD -> atomic(e);
            case REGULAR_EXPRESSION_LITERAL -> RegexLiteral.fromToken(e.text());
            case CONDITIONAL_EXPRESSION -> new TernaryOperation(expression(required(e, Role.CONDITION)),
                                                                expression(required(e, Role.WHEN_TRUE)),
                                                                expression(required(e, Role.WHEN_FALSE)),
                                                                required(e, Role.QUESTION_TOKEN).text(),
                                                                required(e, Role.COLON_TOKEN).text());
            case NO_SUBSTITUTION_TEMPLATE_LITERAL -> new TemplatePattern(new ArrayList<>(List.of(templatePiece(e))));
            case TEMPLATE_EXPRESSION -> templateExpression(e);
            case PREFIX_UNARY_EXPRESSION, POSTFIX_UNARY_EXPRESSION ->
                new UnaryOperation(required(e, Role.OPERATOR_TOKEN).text(),
                                   expression(required(e, Role.OPERAND)),
                                   e.is(SyntaxKind.POSTFIX_UNARY_EXPRESSION));
            case PARENTHESIZED_EXPRESSION -> new Parenthetical(expression(required(e, Role.EXPRESSION)));
            case BINARY_EXPRESSION -> new BinaryOperation(required(e, Role.OPERATOR_TOKEN).text(),
                                                          expression(required(e, Role.LEFT)),
                                                          expression(required(e, Role.RIGHT)));
            case PROPERTY_ACCESS_EXPRESSION -> new PropertyAccess(expression(required(e, Role.EXPRESSION)),
                                                                  identifierName(required(e, Role.NAME)));
            default -> throw unsupported(e, "expression");
        };
        return (Expression) register(result, e);
    }

    /**
     * Call, or the call part of a {@code new} expression. Without parentheses, {@code new Foo}
     * has no argument list at all.
     */
    private Call call(SyntaxElement e, boolean constructor) {
        var callee = required(e, Role.EXPRESSION);

        List<Expression> arguments = null;
        if (!constructor || e.has(Role.ARGUMENTS) || e.has(Role.CLOSE_TOKEN)) {
            arguments = new ArrayList<>();
            for (var argument : e.children(Role.ARGUMENTS)) {
                arguments.add(expression(argument));
            }
        }

        var result = new Call(expression(callee), arguments, types(e.children(Role.TYPE_ARGUMENTS)));
        result.registerWithElement(e);
        result.setText(constructor ? e.text().substring(offset(callee) - offset(e)) : e.text());
        return result;
    }

    private TaggedTemplate taggedTemplate(SyntaxElement e) {
        var template = expression(required(e, Role.TEMPLATE));
        if (!(template instanceof TemplatePattern pattern)) {
            throw unsupported(required(e, Role.TEMPLATE), "tagged template");
        }
        return new TaggedTemplate(expression(required(e, Role.TAG)), pattern);
    }

    private TemplatePattern templateExpression(SyntaxElement e) {
        var parts = new ArrayList<TemplatePart>();
        parts.add(templatePiece(required(e, Role.HEAD)));

        for (var span : e.children(Role.TEMPLATE_SPANS)) {
            parts.add(expression(required(span, Role.EXPRESSION)));
            parts.add(templatePiece(required(span, Role.LITERAL)));
        }
        return new TemplatePattern(parts);
    }

    /**
     * Literal text of a template chunk without its delimiters: the leading backtick or
     * {@code &#125;} and the trailing backtick or {@code $&#123;}.
     */
    private static TemplateLiteralPiece templatePiece(SyntaxElement e) {
        var text = e.text();
        int end = text.endsWith("${") ? text.length() - 2 : text.length() - 1;
        text = text.substring(1, end);

        var result = TemplateLiteralPiece.fromToken(text);
        result.registerWithElement(e);
        result.setText(text);
        return result;
    }

    private ObjectLiteral objectLiteral(SyntaxElement e) {
        var result = register(new ObjectLiteral(), e);
        if (config.recursive()) {
            objectLiteralBody(result, e);
        }
        return result;
    }

    private void objectLiteralBody(ObjectLiteral literal, SyntaxElement e) {
        performBlockAnalysis(literal, e, e.children(Role.PROPERTIES), this::objectLiteralElement, false);
    }

    private CodeNode objectLiteralElement(SyntaxElement e) {
        return switch (e.kind()) {
            case GET_ACCESSOR -> accessor(e, "get");
            case SET_ACCESSOR -> accessor(e, "set");
            case METHOD_DECLARATION -> function(e, true, null);
            case PROPERTY_ASSIGNMENT -> register(new ObjectLiteralProperty(elementName(required(e, Role.NAME)),
                                                                           expression(required(e, Role.INITIALIZER))), e);
            case SHORTHAND_PROPERTY_ASSIGNMENT -> register(new ObjectLiteralProperty(identifier(required(e, Role.NAME))), e);
            default -> throw unsupported(e, "object literal element");
        };
    }

    private ArrayLiteral arrayLiteral(SyntaxElement e) {
        var result = register(new ArrayLiteral(), e);
        if (config.recursive()) {
            arrayLiteralBody(result, e);
        }
        return result;
    }

    private void arrayLiteralBody(ArrayLiteral literal, SyntaxElement e) {
        performBlockAnalysis(literal, e, e.children(Role.ELEMENTS), this::expressionNode, false);
    }

    private AtomicValue atomic(SyntaxElement e) {
        return register(new AtomicValue(e.text()), e);
    }

    private static boolean isLiteral(SyntaxElement e) {
        return switch (e.kind()) {
            case NUMERIC_LITERAL, STRING_LITERAL, TRUE_KEYWORD, FALSE_KEYWORD, NULL_KEYWORD -> true;
            default -> false;
        };
    }

    // === Types ===

    private TypeNode optionalType(SyntaxElement e, Role role) {
        return e.child(role).map(this::type).orElse(null);
    }

    private List<TypeNode> types(List<SyntaxElement> elements) {
        var result = new ArrayList<TypeNode>();
        for (var element : elements) {
            result.add(type(element));
        }
        return result;
    }

    private TypeNode type(SyntaxElement e) {
        CodeNode result = switch (e.kind()) {
            case TYPE_QUERY -> new TypeOf(entityName(required(e, Role.NAME)).asExpression());
            case PARENTHESIZED_TYPE -> new ParenthesizedType(type(required(e, Role.TYPE)));
            case TUPLE_TYPE -> new TupleType(types(e.children(Role.TYPES)));
            case TYPE_REFERENCE -> new QualifiedTypeName(entityName(required(e, Role.NAME)),
                                                         types(e.children(Role.TYPE_ARGUMENTS)));
            case ARRAY_TYPE -> new ArrayType(type(required(e, Role.ELEMENT_TYPE)));
            case UNION_TYPE -> new UnionType(types(e.children(Role.TYPES)));
            case TYPE_LITERAL -> typeLiteral(e);
            case CONSTRUCTOR_TYPE -> callableType(e, keywordName("new", e));
            case FUNCTION_TYPE -> callableType(e, null);
            case ANY_KEYWORD, BOOLEAN_KEYWORD, STRING_KEYWORD, NUMBER_KEYWORD, VOID_KEYWORD, SYMBOL_KEYWORD ->
                new KeywordType(e.text());
            default -> throw unsupported(e, "type");
        };
        return (TypeNode) register(result, e);
    }

    private TypeLiteral typeLiteral(SyntaxElement e) {
        var result = register(new TypeLiteral(), e);
        if (config.recursive()) {
            typeLiteralBody(result, e);
        }
        return result;
    }

    private void typeLiteralBody(TypeLiteral literal, SyntaxElement e) {
        performBlockAnalysis(literal, e, e.children(Role.MEMBERS), this::member, false);
    }

    // === Helpers ===

    private static List<String> modifiers(SyntaxElement e) {
        var result = new ArrayList<String>();
        for (var modifier : e.children(Role.MODIFIERS)) {
            result.add(modifier.text());
        }
        return result;
    }

    private List<Expression> decorators(SyntaxElement e) {
        var result = new ArrayList<Expression>();
        for (var decorator : e.children(Role.DECORATORS)) {
            result.add(expression(required(decorator, Role.EXPRESSION)));
        }
        return result;
    }

    private static <T extends CodeNode> T register(T node, SyntaxElement e) {
        node.registerWithElement(e);
        node.setText(e.text());
        return node;
    }

    private static int offset(SyntaxElement e) {
        return e.span().start().offset();
    }

    private static SyntaxElement required(SyntaxElement e, Role role) {
        return e.child(role)
                .orElseThrow(() -> malformed(e, role));
    }

    private static AnalysisException malformed(SyntaxElement e, Role role) {
        return new AnalysisException(new AnalysisError.MalformedReference(e.kind(), e.text(), role.name()));
    }

    private static AnalysisException unsupported(SyntaxElement e, String context) {
        return new AnalysisException(new AnalysisError.UnsupportedConstruct(e.kind(), e.text(), context, e.span()));
    }

    private static AnalysisException missingOrigin(Block block) {
        var text = block.cachedText().orElse("");
        return new AnalysisException(new AnalysisError.MalformedReference(SyntaxKind.UNKNOWN,
                                                                           text,
                                                                           "origin element of " + block.getClass()
                                                                                                       .getSimpleName()));
    }
}
