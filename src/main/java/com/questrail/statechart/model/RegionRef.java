package com.questrail.statechart.model;

/**
 * Builder-time handle of a region. The handle equals the region's index in the
 * built {@link Machine}.
 */
public record RegionRef(int handle, String name)
{
}
