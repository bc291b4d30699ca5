package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.MorphDecl;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;

/**
 * Enters the scope of a morph of the current node.
 */
public class MorphAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.enterMorph(symbolTable.resolved((MorphDecl) node).orElse(null));
    }
}
