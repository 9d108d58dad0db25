package org.dxworks.fortranframe.model;

/**
 * Kind-specific state carried by a {@link Node}. Which implementation a node holds is
 * fixed by its {@link NodeKind} at construction time.
 */
public interface NodePayload {
}
