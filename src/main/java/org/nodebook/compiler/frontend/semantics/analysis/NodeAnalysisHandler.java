package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.NodeDecl;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;

/**
 * Enters the scope of the node a heading resolved to in pass 1.
 */
public class NodeAnalysisHandler implements IAnalysisHandler {

    @Override
    public void analyze(AstNode node, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        symbolTable.enterNode(symbolTable.resolved((NodeDecl) node).orElse(null));
    }
}
