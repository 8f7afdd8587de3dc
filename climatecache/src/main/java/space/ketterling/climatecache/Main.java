/*
* Copyright 2025 Taylor Ketterling
* Maintenance entry point for the climate observation cache.
*
* Loads configuration and the schema registry, then runs one command against
* the configured cache directory: upgrading every document to the current
* schema, rebuilding the summary index, or listing the years cached for a place.
*/

package space.ketterling.climatecache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.climatecache.cache.CacheCodec;
import space.ketterling.climatecache.cache.CacheMigration;
import space.ketterling.climatecache.cache.CacheStore;
import space.ketterling.climatecache.cache.YearRanges;
import space.ketterling.climatecache.config.AppConfig;
import space.ketterling.climatecache.measure.Measure;
import space.ketterling.climatecache.measure.MeasureRegistry;
import space.ketterling.climatecache.schema.SchemaRegistry;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.SortedSet;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final String USAGE = "usage: climatecache migrate | reindex | years <place> <measure>";

    public static void main(String[] args) throws Exception {
        int rc = run(args, AppConfig.load(), System.out);
        if (rc != 0)
            System.exit(rc);
    }

    /**
     * Runs one command and returns the process exit code.
     */
    static int run(String[] args, AppConfig cfg, PrintStream out) throws Exception {
        if (args.length == 0) {
            out.println(USAGE);
            return 2;
        }

        SchemaRegistry schema = SchemaRegistry.load(cfg.schemaRegistry());
        MeasureRegistry measures = new MeasureRegistry(schema);
        CacheCodec codec = new CacheCodec(schema, new CacheMigration(schema, measures));
        CacheStore store = new CacheStore(cfg.dataCacheDir(), codec, measures, new ObjectMapper(),
                cfg.documentMemo());
        log.info("Cache directory {} (schema v{})", cfg.dataCacheDir().toAbsolutePath(), schema.currentVersion());

        switch (args[0]) {
            case "migrate" -> {
                int migrated = store.migrateAll();
                out.println("Migrated " + migrated + " cache file(s) to schema v" + schema.currentVersion());
                return 0;
            }
            case "reindex" -> {
                int indexed = store.index().rebuild();
                out.println("Indexed " + indexed + " cache file(s)");
                return 0;
            }
            case "years" -> {
                if (args.length != 3) {
                    out.println(USAGE);
                    return 2;
                }
                Measure measure = Measure.fromKey(args[2]);
                Path file = store.pathForPlace(args[1]);
                SortedSet<Integer> years = store.getCachedYears(file, measure);
                out.println(years.isEmpty() ? "No cached years" : YearRanges.condense(years));
                return 0;
            }
            default -> {
                out.println(USAGE);
                return 2;
            }
        }
    }
}
