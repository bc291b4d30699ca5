package org.nodebook.compiler.frontend.semantics;

import org.nodebook.compiler.ImplicitTargetPolicy;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.AttributeDecl;
import org.nodebook.compiler.frontend.parser.ast.MorphDecl;
import org.nodebook.compiler.frontend.parser.ast.NodeDecl;
import org.nodebook.compiler.frontend.parser.ast.RelationDecl;
import org.nodebook.compiler.frontend.semantics.analysis.AttributeAnalysisHandler;
import org.nodebook.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.nodebook.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.nodebook.compiler.frontend.semantics.analysis.MorphAnalysisHandler;
import org.nodebook.compiler.frontend.semantics.analysis.MorphSymbolCollector;
import org.nodebook.compiler.frontend.semantics.analysis.NodeAnalysisHandler;
import org.nodebook.compiler.frontend.semantics.analysis.NodeSymbolCollector;
import org.nodebook.compiler.frontend.semantics.analysis.RelationAnalysisHandler;
import org.nodebook.schema.SchemaSnapshot;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping parse tree classes to symbol collectors (pass 1) and analysis
 * handlers (pass 2).
 */
public final class AnalysisHandlerRegistry {

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final Map<Class<? extends AstNode>, ISymbolCollector> collectors = new HashMap<>();

    /**
     * Registers a pass-2 analysis handler for the given parse tree class.
     *
     * @param nodeType The concrete parse tree class.
     * @param handler  The handler instance.
     * @param <T>      Concrete parse tree type.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAnalysisHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Registers a pass-1 symbol collector for the given parse tree class.
     *
     * @param nodeType  The concrete parse tree class.
     * @param collector The collector instance.
     * @param <T>       Concrete parse tree type.
     */
    public <T extends AstNode> void registerCollector(Class<T> nodeType, ISymbolCollector collector) {
        collectors.put(nodeType, collector);
    }

    public Optional<IAnalysisHandler> resolveHandler(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    public Optional<ISymbolCollector> resolveCollector(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(collectors.get(nodeType));
    }

    /**
     * Creates a registry pre-populated with the default handlers and collectors.
     *
     * @param schema       The pinned schema snapshot.
     * @param hierarchy    Ancestry queries over that snapshot.
     * @param targetPolicy How undeclared relation targets are handled.
     * @return A fully initialized registry.
     */
    public static AnalysisHandlerRegistry initializeWithDefaults(SchemaSnapshot schema, TypeHierarchy hierarchy,
                                                                 ImplicitTargetPolicy targetPolicy) {
        AnalysisHandlerRegistry registry = new AnalysisHandlerRegistry();

        // Pass-1 collectors
        registry.registerCollector(NodeDecl.class, new NodeSymbolCollector(hierarchy));
        registry.registerCollector(MorphDecl.class, new MorphSymbolCollector());

        // Pass-2 handlers
        registry.register(NodeDecl.class, new NodeAnalysisHandler());
        registry.register(MorphDecl.class, new MorphAnalysisHandler());
        registry.register(RelationDecl.class, new RelationAnalysisHandler(schema, targetPolicy));
        registry.register(AttributeDecl.class, new AttributeAnalysisHandler(schema));

        return registry;
    }
}
