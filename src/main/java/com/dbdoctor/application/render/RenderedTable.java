package com.dbdoctor.application.render;

import java.util.List;

/**
 * A header row plus data rows, ready to be handed to the console.
 */
public record RenderedTable(String title, List<String> header, List<List<String>> rows) {

    public RenderedTable {
        header = List.copyOf(header);
        rows = rows.stream().map(List::copyOf).toList();
    }
}
