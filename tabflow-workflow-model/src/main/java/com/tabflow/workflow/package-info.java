/**
 * Workflow model shared between the project loader, the compiler and the execution-plan builder.
 *
 * <ul>
 *   <li>{@link com.tabflow.workflow.source} – region-partitioned input records
 *       ({@link com.tabflow.workflow.source.WorkflowSource}, {@link com.tabflow.workflow.source.RegionSource},
 *       {@link com.tabflow.workflow.source.SourceNode}, {@link com.tabflow.workflow.source.SourceEdge})</li>
 *   <li>{@link com.tabflow.workflow.hierarchy} – synthesized execution hierarchy
 *       ({@link com.tabflow.workflow.hierarchy.HierarchyNode}: LEAF, SEQUENCE, PARALLEL)</li>
 *   <li>{@link com.tabflow.workflow.WorkflowJson} – {@code sourceFromJson}/{@code toJson}
 *       for sources and hierarchies</li>
 * </ul>
 */
package com.tabflow.workflow;
