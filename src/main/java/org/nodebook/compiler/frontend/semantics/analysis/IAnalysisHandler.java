package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;

/**
 * Pass-2 handler: checks one kind of declaration against the schema and records
 * the resulting graph entities in the symbol table.
 */
public interface IAnalysisHandler {

    /**
     * Analyzes a single element before its children are traversed.
     *
     * @param node        The element to analyze.
     * @param symbolTable The symbol table, positioned at the enclosing scope.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(AstNode node, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
