package com.questrail.statechart.model;

/**
 * Builder-time handle of a vertex. The handle equals the vertex's index in the
 * built {@link Machine}.
 */
public record VertexRef(int handle, String name)
{
}
