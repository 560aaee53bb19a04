/**
 * Workflow compiler: turns region-partitioned nodes and edges into a strict execution tree.
 * <p>
 * Entry point is {@link com.tabflow.compiler.WorkflowCompiler}. The stages are usable on their own:
 * {@link com.tabflow.compiler.graph.GraphBuilder}, {@link com.tabflow.compiler.validation.WorkflowValidator},
 * {@link com.tabflow.compiler.graph.TopologicalSorter} and
 * {@link com.tabflow.compiler.hierarchy.HierarchySynthesizer}.
 */
package com.tabflow.compiler;
