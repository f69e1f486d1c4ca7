package com.wayq.query;

import com.wayq.geo.Circle;
import org.eclipse.collections.api.list.ImmutableList;

public record CompiledQuery(String filter, Circle region, ImmutableList<String> criteria, String query) {
}
