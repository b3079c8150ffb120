package org.lexidex.search;

import org.lexidex.search.bootstrap.SearchBootstrap;

public class SearchApp {

    public static void main(String[] args) {
        SearchBootstrap.run();
    }
}
