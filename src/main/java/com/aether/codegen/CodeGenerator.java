package com.aether.codegen;

import com.aether.assets.Asset;
import com.aether.binding.BindingResolver;
import com.aether.binding.Diagnostic;
import com.aether.binding.DiagnosticCode;
import com.aether.binding.FragmentValidator;
import com.aether.binding.Resolution;
import com.aether.binding.ResolvedEffect;
import com.aether.binding.ResolvedValue;
import com.aether.binding.Severity;
import com.aether.codegen.ast.JsAst;
import com.aether.codegen.ast.JsRenderer;
import com.aether.model.Action;
import com.aether.model.Document;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.NodeKind;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyType;
import com.aether.variables.Identifiers;
import com.aether.variables.Variable;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a document into a runnable browser project.
 *
 * The tree is lowered depth-first in pre-order. Each node's kind builds the
 * statements for its element from resolved properties, its already lowered
 * children and the names of its event handlers. The result is assembled into a
 * manifest, an entry module that builds the DOM and a state module holding one
 * field per variable and one method per handled event.
 *
 * Output depends only on the document: element names, handler names, field order
 * and file order are all derived from tree order and variable names.
 */
public class CodeGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CodeGenerator.class);

    public static final String MANIFEST = "package.json";
    public static final String ENTRY_MODULE = "src/main.js";
    public static final String STATE_MODULE = "src/state.js";
    public static final String STATE_CLASS = "AppState";
    public static final String ASSET_DIRECTORY = "assets/";

    private static final String HEADER = "Generated by Aether. Changes are overwritten on the next export.";

    private final BindingResolver resolver;
    private final SourceFormatter formatter;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public CodeGenerator(FragmentValidator validator) {
        this(new BindingResolver(validator), new SourceFormatter(validator));
    }

    public CodeGenerator(BindingResolver resolver, SourceFormatter formatter) {
        this.resolver = resolver;
        this.formatter = formatter;
    }

    /**
     * Generates a project.
     *
     * @param document the document
     * @return the generated project with its report
     */
    public GeneratedProject generate(Document document) {
        return generate(document, new CancellationToken());
    }

    /**
     * Generates a project, polling a token between nodes.
     *
     * @param document the document; must not be edited during the call
     * @param token cancellation token
     * @return the generated project with its report
     * @throws GenerationCancelledException if the token is cancelled before completion
     */
    public GeneratedProject generate(Document document, CancellationToken token) {
        Pass pass = new Pass(document, token);
        List<JsAst.Statement> tree = pass.lower(document.tree().root(), JsAst.id(LoweringContext.ROOT));

        token.throwIfCancelled();
        Map<String, String> files = new LinkedHashMap<>();
        files.put(MANIFEST, manifest(document));
        files.put(ENTRY_MODULE, pass.format(JsRenderer.render(entryModule(tree)), ENTRY_MODULE));
        files.put(STATE_MODULE, pass.format(JsRenderer.render(stateModule(document, pass.handlers)), STATE_MODULE));

        Set<GenerationFlag> flags = EnumSet.noneOf(GenerationFlag.class);
        if (!pass.diagnostics.isEmpty()) {
            flags.add(GenerationFlag.GENERATED_WITH_WARNINGS);
        }
        if (pass.degraded) {
            flags.add(GenerationFlag.FORMATTING_DEGRADED);
        }
        GenerationReport report = new GenerationReport(pass.diagnostics, flags);
        if (report.isClean()) {
            LOGGER.debug("Generated '{}' cleanly ({} nodes)", document.getProjectName(), document.tree().size());
        } else {
            LOGGER.warn("Generated '{}' with {} warnings, flags {}", document.getProjectName(),
                report.diagnostics().size(), report.flags());
        }
        return new GeneratedProject(files, new ArrayList<>(pass.assetCopies.values()), report);
    }

    private String manifest(Document document) {
        JsonObject manifest = new JsonObject();
        manifest.addProperty("name", Identifiers.packageName(document.getProjectName()));
        manifest.addProperty("version", "0.1.0");
        manifest.addProperty("description", document.getProjectName());
        manifest.addProperty("private", true);
        manifest.addProperty("type", "module");
        manifest.addProperty("main", ENTRY_MODULE);
        JsonObject scripts = new JsonObject();
        scripts.addProperty("check", "node --check " + ENTRY_MODULE + " && node --check " + STATE_MODULE);
        manifest.add("scripts", scripts);
        return gson.toJson(manifest) + "\n";
    }

    private static JsAst.Module entryModule(List<JsAst.Statement> tree) {
        List<JsAst.Statement> renderBody = new ArrayList<>();
        renderBody.add(JsAst.exec(JsAst.invoke(JsAst.id(LoweringContext.ROOT), "replaceChildren")));
        renderBody.addAll(tree);

        JsAst.Expression mountPoint = new JsAst.Binary(
            JsAst.invoke(JsAst.id("document"), "getElementById", JsAst.str("app")),
            "??",
            JsAst.member("document", "body"));

        return new JsAst.Module(List.of(
            new JsAst.Comment(HEADER),
            new JsAst.Import(List.of(STATE_CLASS), "./state.js"),
            new JsAst.Blank(),
            new JsAst.Const(LoweringContext.STATE, new JsAst.New(JsAst.id(STATE_CLASS), List.of())),
            new JsAst.Blank(),
            new JsAst.FunctionDeclaration(LoweringContext.RENDER, List.of(LoweringContext.ROOT), renderBody),
            new JsAst.Blank(),
            JsAst.exec(JsAst.invoke(JsAst.id("document"), "addEventListener", JsAst.str("DOMContentLoaded"),
                JsAst.arrow(List.of(JsAst.exec(JsAst.call(JsAst.id(LoweringContext.RENDER), mountPoint))))))));
    }

    private static JsAst.Module stateModule(Document document, List<JsAst.Method> handlers) {
        List<JsAst.Statement> constructor = new ArrayList<>();
        for (Variable variable : document.variables().all()) {
            constructor.add(JsAst.assign(JsAst.member("this", variable.name()), JsAst.literalOf(variable.defaultValue())));
        }
        List<JsAst.Method> methods = new ArrayList<>();
        methods.add(new JsAst.Method("constructor", constructor));
        methods.addAll(handlers);
        return new JsAst.Module(List.of(
            new JsAst.Comment(HEADER),
            new JsAst.ClassDeclaration(STATE_CLASS, true, methods)));
    }

    private static List<JsAst.Statement> handlerBody(ResolvedEffect effect) {
        if (effect instanceof ResolvedEffect.Increment) {
            Variable variable = ((ResolvedEffect.Increment) effect).variable();
            return List.of(new JsAst.Assignment(JsAst.member("this", variable.name()), "+=", JsAst.num(1L)));
        }
        if (effect instanceof ResolvedEffect.Assign) {
            ResolvedEffect.Assign assign = (ResolvedEffect.Assign) effect;
            return List.of(JsAst.assign(JsAst.member("this", assign.variable().name()), assign.value()));
        }
        return List.of(new JsAst.RawStatements(((ResolvedEffect.Inline) effect).source()));
    }

    /**
     * State of one generation run.
     */
    private final class Pass {
        private final Document document;
        private final CancellationToken token;
        private final Map<String, Integer> nameCounters = new HashMap<>();
        private final List<JsAst.Method> handlers = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();
        private final Map<String, AssetCopy> assetCopies = new LinkedHashMap<>();
        private final Map<String, String> assetTargets = new HashMap<>();
        private final Set<String> stateMembers = new HashSet<>();
        private boolean degraded;

        Pass(Document document, CancellationToken token) {
            this.document = document;
            this.token = token;
            stateMembers.add("constructor");
            stateMembers.addAll(document.variables().names());
        }

        List<JsAst.Statement> lower(Node node, JsAst.Expression parent) {
            token.throwIfCancelled();
            NodeKind kind = document.registry().kindOf(node);
            String elementName = nextName(kind.tag());

            Map<String, ResolvedValue> properties = new LinkedHashMap<>();
            for (Map.Entry<String, Resolution<ResolvedValue>> entry
                    : kind.resolveProperties(node, resolver, document.variables()).entrySet()) {
                Resolution<ResolvedValue> resolution = entry.getValue();
                if (resolution.isSuccess()) {
                    properties.put(entry.getKey(), resolution.value());
                } else {
                    warn(resolution.diagnostic());
                    properties.put(entry.getKey(), ResolvedValue.literal(node.property(entry.getKey())));
                }
            }

            Map<String, String> assetPaths = resolveAssets(node, kind, properties);

            Map<NodeEvent, String> nodeHandlers = new EnumMap<>(NodeEvent.class);
            List<JsAst.Statement> placeholders = new ArrayList<>();
            for (Map.Entry<NodeEvent, Action> entry : node.actions().entrySet()) {
                NodeEvent event = entry.getKey();
                if (!kind.supports(event)) {
                    warn(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                        kind.tag() + " does not emit " + event.wireName()).at(node.getId(), event.wireName()));
                    continue;
                }
                Resolution<ResolvedEffect> effect = resolver.resolveAction(entry.getValue(), document.variables());
                if (effect.isSuccess()) {
                    String handlerName = handlerName("on" + Identifiers.capitalize(elementName) + event.handlerSuffix());
                    handlers.add(new JsAst.Method(handlerName, handlerBody(effect.value())));
                    nodeHandlers.put(event, handlerName);
                } else {
                    Diagnostic diagnostic = effect.diagnostic().at(node.getId(), event.wireName());
                    warn(diagnostic);
                    placeholders.add(new JsAst.Comment(String.format("%s handler omitted: %s %s",
                        event.wireName(), diagnostic.code(), diagnostic.message())));
                }
            }

            List<JsAst.Statement> children = new ArrayList<>();
            for (Node child : node.children()) {
                children.addAll(lower(child, JsAst.id(elementName)));
            }

            LoweringContext context = new LoweringContext(node, elementName, parent, properties, assetPaths,
                children, nodeHandlers, placeholders);
            return kind.lower(context);
        }

        // handlers share the state class with the variable fields
        private String handlerName(String base) {
            String name = base;
            for (int n = 2; !stateMembers.add(name); n++) {
                name = base + n;
            }
            if (!name.equals(base)) {
                LOGGER.debug("Handler {} renamed to {} to keep clear of a variable", base, name);
            }
            return name;
        }

        private Map<String, String> resolveAssets(Node node, NodeKind kind, Map<String, ResolvedValue> properties) {
            Map<String, String> paths = new HashMap<>();
            for (PropertyDefinition definition : kind.properties()) {
                if (definition.type() != PropertyType.ASSET) {
                    continue;
                }
                String assetName = properties.get(definition.name()).value().asString();
                if (assetName.isBlank()) {
                    continue;
                }
                Optional<Asset> asset = document.assets().get(assetName);
                if (asset.isEmpty()) {
                    warn(Diagnostic.warn(DiagnosticCode.MISSING_ASSET,
                        String.format("Asset '%s' is not registered", assetName)).at(node.getId(), definition.name()));
                    continue;
                }
                paths.put(definition.name(), exportPath(asset.get()));
            }
            return paths;
        }

        private String exportPath(Asset asset) {
            AssetCopy existing = assetCopies.get(asset.name());
            if (existing != null) {
                return existing.targetPath();
            }
            String target = ASSET_DIRECTORY + asset.fileName();
            if (assetTargets.containsKey(target)) {
                target = ASSET_DIRECTORY + Identifiers.packageName(asset.name()) + "-" + asset.fileName();
            }
            assetTargets.put(target, asset.name());
            assetCopies.put(asset.name(), new AssetCopy(asset.name(), asset.path(), target));
            return target;
        }

        private String nextName(String tag) {
            String base = Identifiers.camelCase(tag);
            int index = nameCounters.merge(base, 1, Integer::sum);
            return base + index;
        }

        private void warn(Diagnostic diagnostic) {
            diagnostics.add(diagnostic);
            LOGGER.warn("Substituted fallback during generation: {}", diagnostic);
        }

        String format(String source, String path) {
            token.throwIfCancelled();
            SourceFormatter.Formatted formatted = formatter.format(source, path);
            if (!formatted.formatted()) {
                degraded = true;
                Diagnostic diagnostic = new Diagnostic(Severity.WARN,
                    DiagnosticCode.FORMATTING_DEGRADED, formatted.problem(), null, path);
                diagnostics.add(diagnostic);
                LOGGER.warn("Emitting {} unformatted: {}", path, formatted.problem());
            }
            return formatted.text();
        }
    }
}
