package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.MorphDecl;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;
import org.nodebook.compiler.frontend.semantics.ProtectedScope;
import org.nodebook.compiler.frontend.semantics.ResolvedMorph;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.graph.Morph;

/**
 * Registers the morphs of the current node. Lines of a morph that failed
 * classification protect the stored contents of that morph from deletion.
 */
public class MorphSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode astNode, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        MorphDecl decl = (MorphDecl) astNode;
        ResolvedNode node = symbolTable.currentNode().orElse(null);
        if (node == null) return;

        ResolvedMorph morph;
        if (decl.defaultMorph()) {
            morph = node.defaultMorph();
        } else {
            morph = node.addMorph(decl.name(), decl.description(), decl.line());
            Morph current = morph.morph();
            if (!decl.description().isBlank() && !decl.description().equals(current.description())) {
                if (current.description().isBlank()) {
                    morph.updateMorph(new Morph(current.morphId(), current.nodeId(), current.name(), decl.description()));
                } else {
                    diagnostics.reportError(ErrorKind.IDENTITY_CONFLICT, "Morph '" + decl.name() + "' of node '"
                            + node.node().baseName() + "' is declared again with a different description", decl.line());
                }
            }
        }

        if (!decl.invalidLines().isEmpty()) {
            symbolTable.protect(ProtectedScope.morph(node.node().id(), morph.morph().morphId()));
        }
        symbolTable.bind(decl, morph);
    }
}
