/**
 * Main application class for the bibliography engine
 *
 * @author William Callahan
 *
 * Features:
 * - Reconciles a local paper library against remote bibliographic sources
 * - One canonical paper per work across sources, with per-source links
 * - Cached reference and citation graphs with a freshness window
 * - Runs on Postgres when a datasource URL is configured, in memory otherwise
 */
package com.williamcallahan.bibliography_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BibliographyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(BibliographyEngineApplication.class, args);
    }
}
