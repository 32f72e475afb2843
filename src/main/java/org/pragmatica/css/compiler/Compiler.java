package org.pragmatica.css.compiler;

import org.pragmatica.css.assembler.Assembler;
import org.pragmatica.css.error.CompilerLogicException;
import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.lexer.CssLexer;
import org.pragmatica.css.lexer.NodeTokenSource;
import org.pragmatica.css.parser.Parser;
import org.pragmatica.css.tree.Node;
import org.pragmatica.css.tree.NodeKind;
import org.pragmatica.css.tree.Position;
import org.pragmatica.css.validation.PatternValidationRuntime;
import org.pragmatica.css.validation.ValidationRuntime;
import org.pragmatica.css.validation.ValidationScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiles a parsed stylesheet into plain CSS, in place.
 *
 * <p>Passes run in a fixed order:
 * <ol>
 *   <li>one walk expanding variables, {@code @import}, {@code @if}/{@code @else} and mixins;
 *       content spliced in by {@code @import} or {@code @if} is visited again, a mixin body
 *       is compiled in its own variable frame before it is spliced in</li>
 *   <li>flattening of nested rules, nested at-rules and nested declarations</li>
 *   <li>selector normalization and validation</li>
 *   <li>validation scripts, when configured</li>
 *   <li>removal of rules left without declarations</li>
 *   <li>header and footer, unless compiling in bare mode</li>
 * </ol>
 *
 * <p>Problems are reported to the {@link Diagnostics} sink and the smallest enclosing unit is
 * dropped; a tree is always produced. A compiled tree compiles again to the same tree.
 */
public final class Compiler {
    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private static final int MAX_MIXIN_EXPANSIONS = 1000;
    private static final Set<String> MESSAGE_AT_RULES = Set.of("error", "warning", "info", "message", "debug");
    private static final Pattern COMMENT_VARIABLE = Pattern.compile("\\{\\$([A-Za-z_][A-Za-z0-9_-]*)}");
    private static final Position PREDEFINED = Position.start("<predefined>");

    private final Diagnostics diagnostics;
    private final CompilerConfig config;
    private final ValidationRuntime validationRuntime;
    private final CompilerState state = new CompilerState();
    private final SearchPaths paths;
    private final Map<String, Node> predefinedVariables = new LinkedHashMap<>();
    private final Map<String, Optional<ValidationScript>> validationScripts = new HashMap<>();
    private final Map<String, String> validationVariables = new HashMap<>();
    private final Set<Path> importedFiles = new HashSet<>();
    private Optional<ValidationScript> validationScript = Optional.empty();
    private Position validationPosition = PREDEFINED;
    private boolean emptyOnUndefinedVariable;
    private int mixinExpansions;

    private Compiler(Diagnostics diagnostics, CompilerConfig config, ValidationRuntime validationRuntime) {
        this.diagnostics = diagnostics;
        this.config = config;
        this.validationRuntime = validationRuntime;
        this.paths = SearchPaths.of(config.searchPaths());
        this.emptyOnUndefinedVariable = config.emptyOnUndefinedVariable();
        setDateTimeVariables(Instant.now());
    }

    public static Compiler create(Diagnostics diagnostics) {
        return create(diagnostics, CompilerConfig.DEFAULT);
    }

    public static Compiler create(Diagnostics diagnostics, CompilerConfig config) {
        return create(diagnostics, config, new PatternValidationRuntime());
    }

    public static Compiler create(Diagnostics diagnostics, CompilerConfig config, ValidationRuntime runtime) {
        return new Compiler(diagnostics, config, runtime);
    }

    public Node root() {
        return state.root();
    }

    /**
     * Set the tree to compile; it must be the {@code LIST} returned by {@link Parser#stylesheet()}.
     */
    public void setRoot(Node root) {
        state.setRoot(root);
    }

    /**
     * Define the {@code $_css_*} date and time variables from a timestamp, in UTC.
     */
    public void setDateTimeVariables(Instant timestamp) {
        var time = timestamp.atZone(ZoneOffset.UTC);
        predefinedVariables.put("_css_year", Node.number(PREDEFINED, time.getYear(), ""));
        predefinedVariables.put("_css_month", Node.number(PREDEFINED, time.getMonthValue(), ""));
        predefinedVariables.put("_css_day", Node.number(PREDEFINED, time.getDayOfMonth(), ""));
        predefinedVariables.put("_css_date", Node.token(NodeKind.STRING, PREDEFINED,
                                                        String.format("%04d-%02d-%02d",
                                                                      time.getYear(),
                                                                      time.getMonthValue(),
                                                                      time.getDayOfMonth())));
        predefinedVariables.put("_css_time", Node.token(NodeKind.STRING, PREDEFINED,
                                                        String.format("%02d:%02d:%02d",
                                                                      time.getHour(),
                                                                      time.getMinute(),
                                                                      time.getSecond())));
        predefinedVariables.put("_css_usdate", Node.token(NodeKind.STRING, PREDEFINED,
                                                          String.format("%02d/%02d/%04d",
                                                                        time.getMonthValue(),
                                                                        time.getDayOfMonth(),
                                                                        time.getYear())));
    }

    public void setEmptyOnUndefinedVariable(boolean emptyOnUndefinedVariable) {
        this.emptyOnUndefinedVariable = emptyOnUndefinedVariable;
    }

    public void clearPaths() {
        paths.clear();
    }

    public void addPath(Path path) {
        paths.add(path);
    }

    /**
     * Resolve a file name through the search paths, the way {@code @import} does.
     */
    public Optional<Path> findFile(String name) {
        return paths.find(name);
    }

    /**
     * Run all the passes over the current root.
     *
     * @param bare when set, no charset, header or footer is added
     */
    public void compile(boolean bare) {
        var root = state.root();
        if (root == null || !root.is(NodeKind.LIST)) {
            throw new CompilerLogicException("compile() requires a LIST root, got " + root);
        }
        state.setRoot(root);
        importedFiles.clear();
        mixinExpansions = 0;

        log.debug("Expanding variables, at-rules, imports and mixins");
        try (var global = state.enter(root)) {
            predefinedVariables.forEach((name, value) -> state.setVariable(name, listOf(value.copy()), false));
            compileContainer(root);
        }
        if (!state.emptyParents()) {
            throw new CompilerLogicException("parent stack not empty after expansion");
        }

        log.debug("Flattening nested rules");
        RuleFlattener.expandNestedComponents(root, diagnostics);

        log.debug("Checking selectors");
        markSelectors(root);

        if (!config.validators().isEmpty()) {
            log.debug("Running validation scripts {}", config.validators());
            validateRules(root);
        }

        log.debug("Removing empty rules");
        removeEmptyRules(root);

        if (!bare) {
            addHeaderAndFooter(root);
        }
    }

    // === Expansion walk ===

    private void compileContainer(Node container) {
        structure(container);
        for (int i = 0; i < container.size(); ) {
            i = compileItem(container, i);
        }
    }

    /**
     * Compile the child at {@code index}; returns the index of the next child to visit.
     */
    private int compileItem(Node container, int index) {
        var n = container.child(index);
        switch (n.kind()) {
            case COMMENT -> {
                replaceVariablesInComment(n);
                return index + 1;
            }
            case VARIABLE_DECLARATION -> {
                setVariable(n);
                container.removeChild(index);
                return index;
            }
            case DECLARATION -> {
                return compileDeclaration(container, n, index);
            }
            case LIST, COMPONENT_VALUE -> {
                return compileQualifiedRule(container, n, index);
            }
            case AT_KEYWORD -> {
                return compileAtKeyword(container, n, index);
            }
            default -> {
                // end of file markers, whitespace and leftovers already reported by the parser
                container.removeChild(index);
                return index;
            }
        }
    }

    private int compileDeclaration(Node container, Node declaration, int index) {
        if (container == state.root()) {
            diagnostics.error(declaration.position(),
                              "a declaration (" + declaration.string() + ") must appear inside a rule.");
            container.removeChild(index);
            return index;
        }
        if (declaration.isEmpty() || !declaration.child(0).is(NodeKind.LIST)) {
            declaration.insertChild(0, Node.list(declaration.position()));
        }
        var value = declaration.child(0);
        trim(value);
        if (value.isEmpty()) {
            diagnostics.error(declaration.position(), "the declaration \"" + declaration.string() + "\" has no value.");
            container.removeChild(index);
            return index;
        }
        replaceVariables(value, 0);
        trim(value);
        if (value.isEmpty()) {
            // every token came from undefined variables expanding to nothing
            container.removeChild(index);
            return index;
        }
        var last = value.lastChild();
        if (last.is(NodeKind.OPEN_CURLYBRACKET) && last.isComplete()) {
            compileContainer(last);
        }
        return index + 1;
    }

    private int compileQualifiedRule(Node container, Node n, int index) {
        if (n.isEmpty() || !n.lastChild().is(NodeKind.OPEN_CURLYBRACKET) || !n.lastChild().isComplete()) {
            // the parser already reported the missing block
            container.removeChild(index);
            return index;
        }
        var rule = n;
        if (n.is(NodeKind.LIST)) {
            rule = Node.of(NodeKind.COMPONENT_VALUE, n.position());
            rule.takeOverChildrenOf(n);
            container.replaceChild(index, rule);
        }
        replaceVariables(rule, 1);
        try (var scope = state.enter(rule)) {
            compileContainer(rule.lastChild());
        }
        return index + 1;
    }

    private int compileAtKeyword(Node container, Node n, int index) {
        var name = n.string().toLowerCase();
        if (MESSAGE_AT_RULES.contains(name)) {
            return reportMessage(container, n, index, name);
        }
        switch (name) {
            case "import" -> {
                return replaceImport(container, n, index);
            }
            case "if" -> {
                return replaceIf(container, index);
            }
            case "else" -> {
                diagnostics.error(n.position(), "found dangling @else without a matching @if.");
                container.removeChild(index);
                return index;
            }
            case "mixin" -> {
                defineMixin(n);
                container.removeChild(index);
                return index;
            }
            case "include" -> {
                return expandInclude(container, n, index);
            }
            default -> {
                replaceVariables(n, RuleFlattener.hasBlock(n) || endsWithSemicolon(n) ? 1 : 0);
                if (RuleFlattener.hasBlock(n)) {
                    try (var scope = state.enter(n)) {
                        compileContainer(n.lastChild());
                    }
                }
                return index + 1;
            }
        }
    }

    private int reportMessage(Node container, Node n, int index, String name) {
        var prelude = prelude(n);
        replaceVariables(prelude);
        trim(prelude);
        var message = prelude.size() == 1 && prelude.child(0).is(NodeKind.STRING)
                      ? prelude.child(0).string()
                      : Assembler.text(prelude.children());
        switch (name) {
            case "error" -> diagnostics.error(n.position(), message);
            case "warning" -> diagnostics.warning(n.position(), message);
            default -> diagnostics.info(n.position(), message);
        }
        container.removeChild(index);
        return index;
    }

    // === Structuring of block contents ===

    /**
     * Turn the raw component values of a block into declarations, variable declarations,
     * at-rules and qualified rules. Already structured children are kept as they are.
     */
    private void structure(Node container) {
        var items = structureItems(container.children());
        container.clearChildren();
        items.forEach(container::addChild);
    }

    private List<Node> structureItems(List<Node> raw) {
        var items = new ArrayList<Node>();
        var current = new ArrayList<Node>();
        for (var node : raw) {
            if (node.is(NodeKind.EOF_TOKEN)) {
                flushItem(current, items);
                continue;
            }
            if (isStructured(node)) {
                flushItem(current, items);
                items.add(node);
                continue;
            }
            current.add(node);
            if (node.is(NodeKind.SEMICOLON) || (node.is(NodeKind.OPEN_CURLYBRACKET) && node.isComplete())) {
                flushItem(current, items);
            }
        }
        flushItem(current, items);
        return items;
    }

    private static boolean isStructured(Node node) {
        return switch (node.kind()) {
            case DECLARATION, VARIABLE_DECLARATION, COMPONENT_VALUE, COMMENT, LIST -> true;
            case AT_KEYWORD -> !node.isEmpty();
            default -> false;
        };
    }

    private void flushItem(List<Node> current, List<Node> items) {
        var tokens = new ArrayList<>(current);
        current.clear();
        while (!tokens.isEmpty() && tokens.get(0).is(NodeKind.WHITESPACE)) {
            tokens.remove(0);
        }
        if (tokens.stream().allMatch(t -> t.is(NodeKind.WHITESPACE) || t.is(NodeKind.SEMICOLON))) {
            return;
        }
        var first = tokens.get(0);
        var last = tokens.get(tokens.size() - 1);
        boolean endsWithBlock = last.is(NodeKind.OPEN_CURLYBRACKET) && last.isComplete();

        if (first.is(NodeKind.AT_KEYWORD)) {
            items.add(parser(tokens).rule());
        } else if (first.is(NodeKind.VARIABLE) || (first.is(NodeKind.IDENTIFIER) && isDeclaration(tokens))) {
            items.addAll(parser(tokens).declarationList().children());
        } else if (endsWithBlock) {
            var rule = Node.list(first.position());
            tokens.forEach(rule::addChild);
            items.add(rule);
        } else {
            diagnostics.error(first.position(),
                              "expected a declaration or a rule, found \"" + Assembler.text(tokens) + "\".");
        }
    }

    /**
     * A name followed by a colon is a declaration unless it ends with a block and the colon
     * is glued to the next token, as in {@code a:hover { ... }}.
     */
    private static boolean isDeclaration(List<Node> tokens) {
        var last = tokens.get(tokens.size() - 1);
        if (!last.is(NodeKind.OPEN_CURLYBRACKET)) {
            return true;
        }
        int colon = 1;
        if (colon < tokens.size() && tokens.get(colon).is(NodeKind.WHITESPACE)) {
            colon++;
        }
        if (colon + 1 >= tokens.size() || !tokens.get(colon).is(NodeKind.COLON)) {
            return false;
        }
        var afterColon = tokens.get(colon + 1);
        return afterColon.is(NodeKind.WHITESPACE) || afterColon.is(NodeKind.OPEN_CURLYBRACKET);
    }

    private Parser parser(List<Node> tokens) {
        var end = tokens.get(tokens.size() - 1).position();
        return Parser.create(NodeTokenSource.of(tokens, end), diagnostics);
    }

    // === Variables ===

    private void setVariable(Node declaration) {
        var value = !declaration.isEmpty() && declaration.child(0).is(NodeKind.LIST)
                    ? declaration.child(0)
                    : Node.list(declaration.position());
        var marker = !declaration.isEmpty() && declaration.lastChild().is(NodeKind.EXCLAMATION)
                     ? declaration.lastChild().string()
                     : "";
        replaceVariables(value, 0);
        trim(value);
        switch (marker) {
            case "" -> state.setVariable(declaration.string(), value, false);
            case "global" -> state.setVariable(declaration.string(), value, true);
            case "default" -> {
                if (state.getVariable(declaration.string(), false).isEmpty()) {
                    state.setVariable(declaration.string(), value, false);
                }
            }
            default -> diagnostics.error(declaration.position(),
                                         "unsupported !" + marker + " on variable \"$" + declaration.string() + "\".");
        }
    }

    private void replaceVariables(Node parent) {
        replaceVariables(parent, 0);
    }

    /**
     * Replace the variable references found in the children of {@code parent}, recursively,
     * leaving the last {@code skipLast} children alone.
     */
    private void replaceVariables(Node parent, int skipLast) {
        for (int i = 0; i < parent.size() - skipLast; ) {
            var child = parent.child(i);
            if (child.is(NodeKind.VARIABLE)) {
                i = replaceVariable(parent, child, i);
                continue;
            }
            replaceVariables(child, 0);
            i++;
        }
    }

    private int replaceVariable(Node parent, Node variable, int index) {
        var value = state.getVariable(variable.string(), false);
        if (value.isPresent()) {
            var tokens = new ArrayList<Node>();
            value.get().children().forEach(token -> tokens.add(token.copy()));
            parent.splice(index, tokens);
            return index + tokens.size();
        }
        if (emptyOnUndefinedVariable) {
            parent.removeChild(index);
            return index;
        }
        diagnostics.error(variable.position(), "variable named \"" + variable.string() + "\" is not set.");
        return index + 1;
    }

    private void replaceVariablesInComment(Node comment) {
        var matcher = COMMENT_VARIABLE.matcher(comment.string());
        var sb = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            var value = state.getVariable(name, false);
            String replacement;
            if (value.isPresent()) {
                replacement = commentText(value.get());
            } else {
                if (!emptyOnUndefinedVariable) {
                    diagnostics.error(comment.position(), "variable named \"" + name + "\" is not set.");
                }
                replacement = emptyOnUndefinedVariable ? "" : matcher.group();
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        comment.setString(sb.toString());
    }

    private static String commentText(Node value) {
        if (value.size() == 1 && value.child(0).is(NodeKind.STRING)) {
            return value.child(0).string();
        }
        return Assembler.text(value.children());
    }

    // === @import ===

    private int replaceImport(Node container, Node n, int index) {
        if (RuleFlattener.hasBlock(n)) {
            diagnostics.error(n.position(), "@import does not accept a block.");
            container.removeChild(index);
            return index;
        }
        replaceVariables(n, endsWithSemicolon(n) ? 1 : 0);
        var tokens = significant(prelude(n).children());
        var target = tokens.isEmpty() ? Optional.<String>empty() : importTarget(tokens.get(0));
        if (target.isEmpty()) {
            diagnostics.error(n.position(), "@import expects a string or a url() as its first parameter.");
            container.removeChild(index);
            return index;
        }
        var name = target.get();
        if (tokens.size() > 1 || isExternal(name)) {
            // plain CSS import kept for the browser
            return index + 1;
        }
        var file = findFile(name).or(() -> name.endsWith(".scss") ? Optional.empty() : findFile(name + ".scss"));
        container.removeChild(index);
        if (file.isEmpty()) {
            diagnostics.error(n.position(), "@import \"" + name + "\" could not be resolved.");
            return index;
        }
        if (!importedFiles.add(file.get())) {
            diagnostics.error(n.position(), "@import \"" + name + "\" was already imported (import cycle?), skipped.");
            return index;
        }
        log.debug("Importing {} from {}", name, file.get());
        String source;
        try {
            source = Files.readString(file.get(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            diagnostics.error(n.position(), "cannot read \"" + file.get() + "\": " + e.getMessage());
            return index;
        }
        var imported = Parser.create(CssLexer.create(source, file.get().toString(), diagnostics), diagnostics)
                             .stylesheet();
        container.insertChildren(index, imported.children());
        return index;
    }

    private static Optional<String> importTarget(Node token) {
        if (token.is(NodeKind.STRING) || token.is(NodeKind.URL)) {
            return Optional.of(token.string());
        }
        if (token.is(NodeKind.FUNCTION) && token.string().equalsIgnoreCase("url")) {
            var inner = significant(token.children());
            if (inner.size() == 1 && inner.get(0).is(NodeKind.STRING)) {
                return Optional.of(inner.get(0).string());
            }
        }
        return Optional.empty();
    }

    private static boolean isExternal(String name) {
        var lower = name.toLowerCase();
        return lower.startsWith("http:") || lower.startsWith("https:") || lower.startsWith("//");
    }

    // === @if / @else ===

    /**
     * Evaluate an {@code @if} together with the {@code @else} siblings right after it and
     * replace the whole chain with the block of the branch chosen, if any.
     */
    private int replaceIf(Node container, int index) {
        var chain = new ArrayList<Node>();
        chain.add(container.child(index));
        for (int i = index + 1; i < container.size(); i++) {
            var next = container.child(i);
            if (!next.is(NodeKind.AT_KEYWORD) || !next.string().equalsIgnoreCase("else")) {
                break;
            }
            chain.add(next);
            if (!isElseIf(next)) {
                break;
            }
        }

        Node chosen = null;
        for (var branch : chain) {
            if (!RuleFlattener.hasBlock(branch)) {
                diagnostics.error(branch.position(), "@" + branch.string() + " is expected to have a block.");
                continue;
            }
            if (chosen != null) {
                continue;
            }
            var condition = significant(prelude(branch).children());
            if (branch.string().equalsIgnoreCase("else")) {
                if (condition.isEmpty()) {
                    chosen = branch;
                    continue;
                }
                condition = condition.subList(1, condition.size());
            }
            if (conditionHolds(condition, branch.position())) {
                chosen = branch;
            }
        }

        for (int k = 0; k < chain.size(); k++) {
            container.removeChild(index);
        }
        if (chosen != null) {
            container.insertChildren(index, structureItems(chosen.lastChild().children()));
        }
        return index;
    }

    private boolean conditionHolds(List<Node> condition, Position position) {
        var expression = Node.list(position);
        condition.forEach(expression::addChild);
        replaceVariables(expression);
        return ExpressionEvaluator.evaluate(expression.children(), position, diagnostics)
                                  .map(ExpressionEvaluator::isTrue)
                                  .orElse(false);
    }

    private static boolean isElseIf(Node elseRule) {
        var prelude = significant(prelude(elseRule).children());
        return !prelude.isEmpty()
               && prelude.get(0).is(NodeKind.IDENTIFIER)
               && prelude.get(0).string().equalsIgnoreCase("if");
    }

    // === Mixins ===

    private void defineMixin(Node n) {
        var tokens = significant(prelude(n).children());
        if (tokens.size() != 1 || !(tokens.get(0).is(NodeKind.IDENTIFIER) || tokens.get(0).is(NodeKind.FUNCTION))) {
            diagnostics.error(n.position(), "@mixin expects a name, optionally followed by its parameters.");
            return;
        }
        if (!RuleFlattener.hasBlock(n)) {
            diagnostics.error(n.position(), "@mixin " + tokens.get(0).string() + " is expected to have a block.");
            return;
        }
        var header = tokens.get(0);
        var parameters = new ArrayList<MixinDefinition.Parameter>();
        if (header.is(NodeKind.FUNCTION)) {
            for (var parameter : splitArguments(header)) {
                if (parameter.isEmpty() || !parameter.get(0).is(NodeKind.VARIABLE)) {
                    diagnostics.error(n.position(), "a @mixin parameter must be a variable, optionally with a default value.");
                    return;
                }
                Optional<List<Node>> defaultValue = Optional.empty();
                var rest = trimmed(parameter.subList(1, parameter.size()));
                if (!rest.isEmpty()) {
                    if (!rest.get(0).is(NodeKind.COLON)) {
                        diagnostics.error(n.position(), "expected ':' after @mixin parameter \"$"
                                                        + parameter.get(0).string() + "\".");
                        return;
                    }
                    defaultValue = Optional.of(trimmed(rest.subList(1, rest.size())));
                }
                parameters.add(new MixinDefinition.Parameter(parameter.get(0).string(), defaultValue));
            }
        }
        log.debug("Defining mixin {}", header.string());
        state.setMixin(new MixinDefinition(header.string(), List.copyOf(parameters), n.lastChild().copy(), n.position()));
    }

    private int expandInclude(Node container, Node n, int index) {
        container.removeChild(index);
        var tokens = significant(prelude(n).children());
        if (tokens.size() != 1 || !(tokens.get(0).is(NodeKind.IDENTIFIER) || tokens.get(0).is(NodeKind.FUNCTION))) {
            diagnostics.error(n.position(), "@include expects a mixin name, optionally followed by its arguments.");
            return index;
        }
        var call = tokens.get(0);
        var mixin = state.getMixin(call.string());
        if (mixin.isEmpty()) {
            diagnostics.error(n.position(), "unknown mixin \"" + call.string() + "\".");
            return index;
        }
        if (++mixinExpansions > MAX_MIXIN_EXPANSIONS) {
            diagnostics.error(n.position(), "too many mixin expansions, \"" + call.string() + "\" is probably recursive.");
            return index;
        }
        var arguments = bindArguments(mixin.get(), call, n.position());
        if (arguments.isEmpty()) {
            return index;
        }

        // variables declared by the body live in the frame of this expansion only
        var body = mixin.get().body().copy();
        try (var scope = state.enter(n)) {
            arguments.get().forEach((name, value) -> state.setVariable(name, value, false));
            compileContainer(body);
        }
        var items = new ArrayList<Node>();
        for (var item : body.children()) {
            if (item.is(NodeKind.DECLARATION) && container == state.root()) {
                diagnostics.error(item.position(),
                                  "a declaration (" + item.string() + ") must appear inside a rule.");
                continue;
            }
            items.add(item);
        }
        container.insertChildren(index, items);
        return index + items.size();
    }

    /**
     * Match the call arguments, positional then named, to the mixin parameters.
     */
    private Optional<Map<String, Node>> bindArguments(MixinDefinition mixin, Node call, Position position) {
        var bound = new LinkedHashMap<String, Node>();
        var parameters = mixin.parameters();
        var arguments = call.is(NodeKind.FUNCTION)
                        ? splitArguments(call)
                        : List.<List<Node>>of();
        int positional = 0;
        for (var argument : arguments) {
            if (argument.size() > 2 && argument.get(0).is(NodeKind.VARIABLE) && followedByColon(argument)) {
                var name = argument.get(0).string();
                if (parameters.stream().noneMatch(p -> p.name().equals(name))) {
                    diagnostics.error(position, "mixin \"" + mixin.name() + "\" has no parameter named \"$" + name + "\".");
                    return Optional.empty();
                }
                var value = listOf(trimmed(argument.subList(2, argument.size())));
                replaceVariables(value);
                bound.put(name, value);
                continue;
            }
            if (positional >= parameters.size()) {
                diagnostics.error(position, "too many arguments passed to mixin \"" + mixin.name() + "\".");
                return Optional.empty();
            }
            var value = listOf(argument);
            replaceVariables(value);
            bound.put(parameters.get(positional++).name(), value);
        }
        for (var parameter : parameters) {
            if (bound.containsKey(parameter.name())) {
                continue;
            }
            if (parameter.defaultValue().isEmpty()) {
                diagnostics.error(position, "missing argument \"$" + parameter.name()
                                            + "\" in call to mixin \"" + mixin.name() + "\".");
                return Optional.empty();
            }
            var value = listOf(parameter.defaultValue().get());
            replaceVariables(value);
            bound.put(parameter.name(), value);
        }
        return Optional.of(bound);
    }

    private static boolean followedByColon(List<Node> argument) {
        return trimmed(argument.subList(1, argument.size())).get(0).is(NodeKind.COLON);
    }

    /**
     * Split function arguments on commas, each argument without surrounding whitespace.
     */
    private static List<List<Node>> splitArguments(Node function) {
        var result = new ArrayList<List<Node>>();
        var current = new ArrayList<Node>();
        for (var child : function.children()) {
            if (child.is(NodeKind.COMMA)) {
                result.add(trimmed(current));
                current = new ArrayList<>();
            } else {
                current.add(child);
            }
        }
        var last = trimmed(current);
        if (!last.isEmpty() || !result.isEmpty()) {
            result.add(last);
        }
        return result;
    }

    // === Selectors, validation, pruning ===

    private void markSelectors(Node container) {
        for (int i = 0; i < container.size(); ) {
            var n = container.child(i);
            if (n.is(NodeKind.COMPONENT_VALUE)) {
                var selector = SelectorValidator.normalize(RuleFlattener.selectorOf(n));
                if (!SelectorValidator.parseSelector(selector, n.position(), diagnostics)) {
                    container.removeChild(i);
                    continue;
                }
                RuleFlattener.setSelector(n, List.copyOf(selector));
            } else if (n.is(NodeKind.AT_KEYWORD) && RuleFlattener.hasBlock(n)) {
                if (RuleFlattener.isKeyframes(n)) {
                    normalizeKeyframes(n.lastChild());
                } else {
                    markSelectors(n.lastChild());
                }
            }
            i++;
        }
    }

    private static void normalizeKeyframes(Node block) {
        for (var frame : block.children()) {
            if (frame.is(NodeKind.COMPONENT_VALUE)) {
                RuleFlattener.setSelector(frame, List.copyOf(SelectorValidator.normalize(RuleFlattener.selectorOf(frame))));
            }
        }
    }

    private void validateRules(Node container) {
        for (var n : container.children()) {
            if (n.is(NodeKind.COMPONENT_VALUE)) {
                var selector = Assembler.text(RuleFlattener.selectorOf(n));
                for (var declaration : n.lastChild().children()) {
                    if (declaration.is(NodeKind.DECLARATION)) {
                        validateDeclaration(selector, declaration);
                    }
                }
            } else if (n.is(NodeKind.AT_KEYWORD) && RuleFlattener.hasBlock(n)) {
                validateRules(n.lastChild());
            }
        }
    }

    private void validateDeclaration(String selector, Node declaration) {
        var value = declaration.isEmpty() || !declaration.child(0).is(NodeKind.LIST)
                    ? ""
                    : Assembler.text(declaration.child(0).children());
        for (var validator : config.validators()) {
            setValidationScript(validator, declaration.position());
            addValidationVariable("selector", selector);
            addValidationVariable("property", declaration.string());
            addValidationVariable("value", value);
            runValidation(false);
        }
    }

    /**
     * Select the script used by the next {@link #runValidation}, loading it on first use.
     */
    void setValidationScript(String name, Position position) {
        validationPosition = position;
        validationScript = validationScripts.computeIfAbsent(name, this::loadValidationScript);
    }

    void addValidationVariable(String name, String value) {
        validationVariables.put(name, value);
    }

    /**
     * Run the current script with the variables added since the last run.
     *
     * @param checkOnly when set, a failure is only returned, not reported
     * @return whether the script passed; a missing script passes
     */
    boolean runValidation(boolean checkOnly) {
        var variables = Map.copyOf(validationVariables);
        validationVariables.clear();
        if (validationScript.isEmpty()) {
            return true;
        }
        var verdict = validationRuntime.run(validationScript.get(), variables);
        if (!verdict.passed() && !checkOnly) {
            var message = "validation \"" + validationScript.get().name() + "\" failed: " + verdict.message();
            if (config.fatalValidation()) {
                diagnostics.error(validationPosition, message);
            } else {
                diagnostics.warning(validationPosition, message);
            }
        }
        return verdict.passed();
    }

    private Optional<ValidationScript> loadValidationScript(String name) {
        var file = findFile(name);
        if (file.isEmpty()) {
            diagnostics.error(validationPosition, "validation script \"" + name + "\" was not found.");
            return Optional.empty();
        }
        try {
            log.debug("Loading validation script {} from {}", name, file.get());
            return Optional.of(validationRuntime.load(name, file.get()));
        } catch (IOException | IllegalArgumentException e) {
            diagnostics.error(validationPosition, "cannot load validation script \"" + name + "\": " + e.getMessage());
            return Optional.empty();
        }
    }

    private static void removeEmptyRules(Node container) {
        for (int i = container.size() - 1; i >= 0; i--) {
            var n = container.child(i);
            if (n.is(NodeKind.COMPONENT_VALUE)) {
                if (n.lastChild().children().stream().noneMatch(c -> c.is(NodeKind.DECLARATION))) {
                    container.removeChild(i);
                }
            } else if (n.is(NodeKind.AT_KEYWORD) && RuleFlattener.hasBlock(n)) {
                var block = n.lastChild();
                removeEmptyRules(block);
                if (block.children().stream().allMatch(c -> c.is(NodeKind.WHITESPACE))) {
                    container.removeChild(i);
                }
            }
        }
    }

    // === Header and footer ===

    private void addHeaderAndFooter(Node root) {
        int index = 0;
        if (root.isEmpty() || !root.child(0).is(NodeKind.AT_KEYWORD) || !root.child(0).string().equalsIgnoreCase("charset")) {
            var charset = Node.token(NodeKind.AT_KEYWORD, root.position(), "charset");
            charset.addChild(Node.of(NodeKind.WHITESPACE, root.position()));
            charset.addChild(Node.token(NodeKind.STRING, root.position(), "UTF-8"));
            charset.addChild(Node.of(NodeKind.SEMICOLON, root.position()));
            root.insertChild(0, charset);
        }
        index++;
        if (!config.header().isEmpty() && !isComment(root, index, config.header())) {
            root.insertChild(index, Node.token(NodeKind.COMMENT, root.position(), config.header()));
        }
        if (!config.footer().isEmpty() && !isComment(root, root.size() - 1, config.footer())) {
            root.addChild(Node.token(NodeKind.COMMENT, root.position(), config.footer()));
        }
    }

    private static boolean isComment(Node root, int index, String text) {
        return index >= 0 && index < root.size()
               && root.child(index).is(NodeKind.COMMENT)
               && root.child(index).string().equals(text);
    }

    // === Helpers ===

    /**
     * The children of an at-rule without its trailing block or ';', as a detached list.
     */
    private static Node prelude(Node atRule) {
        var result = Node.list(atRule.position());
        int end = atRule.size();
        if (end > 0 && (atRule.lastChild().is(NodeKind.OPEN_CURLYBRACKET) || atRule.lastChild().is(NodeKind.SEMICOLON))) {
            end--;
        }
        for (int i = 0; i < end; i++) {
            result.addChild(atRule.child(i));
        }
        return result;
    }

    private static boolean endsWithSemicolon(Node atRule) {
        return !atRule.isEmpty() && atRule.lastChild().is(NodeKind.SEMICOLON);
    }

    private static List<Node> significant(List<Node> tokens) {
        var result = new ArrayList<Node>();
        for (var token : tokens) {
            if (!token.is(NodeKind.WHITESPACE)) {
                result.add(token);
            }
        }
        return result;
    }

    private static List<Node> trimmed(List<Node> tokens) {
        int start = 0;
        int end = tokens.size();
        while (start < end && tokens.get(start).is(NodeKind.WHITESPACE)) {
            start++;
        }
        while (end > start && tokens.get(end - 1).is(NodeKind.WHITESPACE)) {
            end--;
        }
        return List.copyOf(tokens.subList(start, end));
    }

    private static Node listOf(Node token) {
        return listOf(List.of(token));
    }

    private static Node listOf(List<Node> tokens) {
        var position = tokens.isEmpty()
                       ? PREDEFINED
                       : tokens.get(0).position();
        var list = Node.list(position);
        tokens.forEach(token -> list.addChild(token.copy()));
        return list;
    }

    /**
     * Remove the leading and trailing whitespace children of a node.
     */
    static void trim(Node list) {
        while (!list.isEmpty() && list.child(0).is(NodeKind.WHITESPACE)) {
            list.removeChild(0);
        }
        while (!list.isEmpty() && list.lastChild().is(NodeKind.WHITESPACE)) {
            list.removeChild(list.size() - 1);
        }
    }
}
