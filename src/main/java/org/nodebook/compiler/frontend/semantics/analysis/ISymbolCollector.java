package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;

/**
 * Pass-1 collector: registers the nodes and morphs a declaration introduces
 * before any relation is checked, so that relations may reference nodes declared
 * further down.
 */
public interface ISymbolCollector {

    /**
     * Collects symbols from an element before its children are visited.
     *
     * @param node        The parse tree element.
     * @param symbolTable The symbol table to populate.
     * @param diagnostics The engine for reporting errors.
     */
    void collect(AstNode node, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
