package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.AttributeDecl;
import org.nodebook.compiler.frontend.semantics.AttributeValueParser;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;
import org.nodebook.compiler.frontend.semantics.ProtectedScope;
import org.nodebook.compiler.frontend.semantics.ResolvedMorph;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.compiler.frontend.semantics.TypeHierarchy;
import org.nodebook.graph.Attribute;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.MorphId;
import org.nodebook.schema.AttributeType;
import org.nodebook.schema.SchemaSnapshot;

/**
 * Checks an attribute declaration against its attribute type: existence, scope,
 * value type and allowed values. A declaration without a unit takes the default
 * unit of its type.
 */
public class AttributeAnalysisHandler implements IAnalysisHandler {

    private final SchemaSnapshot schema;

    public AttributeAnalysisHandler(SchemaSnapshot schema) {
        this.schema = schema;
    }

    @Override
    public void analyze(AstNode astNode, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        AttributeDecl decl = (AttributeDecl) astNode;
        ResolvedNode node = symbolTable.currentNode().orElse(null);
        ResolvedMorph morph = symbolTable.currentMorph().orElse(null);
        if (node == null || morph == null) return;

        MorphId morphId = morph.morph().morphId();
        ProtectedScope skipped = ProtectedScope.entry(node.node().id(), morphId, decl.name());
        AttributeType type = schema.attributeType(decl.name()).orElse(null);
        if (type == null) {
            diagnostics.reportError(ErrorKind.UNKNOWN_ATTRIBUTE_TYPE,
                    "Unknown attribute type '" + decl.name() + "'", decl.line());
            symbolTable.protect(skipped);
            return;
        }
        if (!TypeHierarchy.satisfies(node.node().parentTypes(), type.scope())) {
            diagnostics.reportError(ErrorKind.ATTRIBUTE_OUT_OF_SCOPE, "Attribute '" + type.name()
                    + "' applies to " + type.scope() + " but '" + node.node().baseName() + "' is "
                    + (node.node().parentTypes().isEmpty() ? "untyped" : node.node().parentTypes().toString()),
                    decl.line());
            symbolTable.protect(skipped);
            return;
        }

        AttributeValueParser.Result result = AttributeValueParser.parse(type, decl.value());
        if (result instanceof AttributeValueParser.Rejected rejected) {
            diagnostics.reportError(ErrorKind.INVALID_ATTRIBUTE_VALUE,
                    "Invalid value for '" + type.name() + "': " + rejected.reason(), decl.line());
            symbolTable.protect(skipped);
            return;
        }

        AttributeValueParser.Parsed parsed = (AttributeValueParser.Parsed) result;
        String sourceId = node.node().id();
        String unit = decl.unit() != null ? decl.unit() : type.unit();
        ResolvedMorph.AddOutcome outcome = morph.addAttribute(new Attribute(
                Identifiers.attributeId(sourceId, type.name(), decl.value(), morphId),
                sourceId, type.name(), decl.value(), unit, decl.modality(), decl.quantifier(), decl.adverb(),
                false, morphId, null), parsed.value());
        if (outcome == ResolvedMorph.AddOutcome.CONFLICT) {
            diagnostics.reportError(ErrorKind.IDENTITY_CONFLICT, "Attribute '" + type.name() + ": " + decl.value()
                    + "' of '" + node.node().baseName() + "' is declared again with different modifiers",
                    decl.line());
        }
    }
}
