package io.griddedetl.era5.orchestrate;

import io.griddedetl.era5.model.UnitKey;
import io.griddedetl.era5.table.TableFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds raw gridded files under an input root and derives each one's (year, month): from a
 * {@code YYYYMM} run in the file name, then {@code era5_YYYY_MM}, then {@code <YYYY>/<MM>/} parent
 * directories.
 */
public class FileDiscovery {
    private static final Logger LOG = LoggerFactory.getLogger(FileDiscovery.class);
    public static final Set<String> RAW_EXTENSIONS = Set.of(".grib", ".grb", ".grib2", ".grb2", ".nc", ".nc4");

    private static final Pattern COMPACT = Pattern.compile("(\\d{4})(\\d{2})");
    private static final Pattern ERA5 = Pattern.compile("era5[_-](\\d{4})[_-]?(\\d{2})", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_DIR = Pattern.compile("\\d{4}");
    private static final Pattern MONTH_DIR = Pattern.compile("\\d{1,2}");

    private final Integer startYear;
    private final Integer endYear;

    public FileDiscovery(Integer startYear, Integer endYear) {
        this.startYear = startYear;
        this.endYear = endYear;
    }

    public static FileDiscovery unbounded() {
        return new FileDiscovery(null, null);
    }

    /**
     * Raw files under {@code root}, chronologically by unit then by path. Files whose unit cannot be
     * derived are logged and passed to {@code skipped}.
     */
    public List<DiscoveredFile> discover(Path root, List<Path> skipped) throws DiscoveryException {
        if (!Files.isDirectory(root)) throw new DiscoveryException("input directory does not exist: " + root);
        List<Path> candidates;
        try (Stream<Path> s = Files.walk(root)) {
            candidates = s.filter(Files::isRegularFile).filter(FileDiscovery::isRaw).sorted().toList();
        } catch (IOException e) {
            throw new DiscoveryException("cannot scan " + root, e);
        }
        List<DiscoveredFile> out = new ArrayList<>();
        for (Path p : candidates) {
            try {
                UnitKey key = unitOf(root, p);
                if (inRange(key.year())) out.add(new DiscoveredFile(p, key));
            } catch (DiscoveryException e) {
                LOG.warn("{}, skipping", e.getMessage());
                if (skipped != null) skipped.add(p);
            }
        }
        out.sort(Comparator.comparing(DiscoveredFile::unit).thenComparing(DiscoveredFile::path));
        LOG.info("found {} raw file(s) under {}", out.size(), root);
        return out;
    }

    /** Joined tables ({@code joined_*.csv|csv.gz|parquet}) anywhere under {@code root}. */
    public static List<Path> joinedTables(Path root) throws IOException {
        if (!Files.isDirectory(root)) return List.of();
        try (Stream<Path> s = Files.walk(root)) {
            return s.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith("joined_") && TableFormat.isTable(p))
                    .filter(p -> !p.getParent().getFileName().toString().equals("backup"))
                    .sorted()
                    .toList();
        }
    }

    static boolean isRaw(Path p) {
        String n = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = n.lastIndexOf('.');
        return dot >= 0 && RAW_EXTENSIONS.contains(n.substring(dot));
    }

    public static UnitKey unitOf(Path root, Path file) throws DiscoveryException {
        String name = file.getFileName().toString();
        Optional<UnitKey> key = fromName(COMPACT, name).or(() -> fromName(ERA5, name)).or(() -> fromDirectories(root, file));
        return key.orElseThrow(() -> new DiscoveryException("could not determine year/month for " + file));
    }

    private static Optional<UnitKey> fromName(Pattern pattern, String name) {
        Matcher m = pattern.matcher(name);
        int from = 0;
        while (from < name.length() && m.find(from)) {
            Optional<UnitKey> k = key(m.group(1), m.group(2));
            if (k.isPresent()) return k;
            from = m.start() + 1;
        }
        return Optional.empty();
    }

    private static Optional<UnitKey> fromDirectories(Path root, Path file) {
        Path rel = root.relativize(file);
        for (int i = 0; i + 1 < rel.getNameCount() - 1; i++) {
            String y = rel.getName(i).toString();
            String m = rel.getName(i + 1).toString();
            if (YEAR_DIR.matcher(y).matches() && MONTH_DIR.matcher(m).matches()) {
                Optional<UnitKey> k = key(y, m);
                if (k.isPresent()) return k;
            }
        }
        return Optional.empty();
    }

    private static Optional<UnitKey> key(String year, String month) {
        int mm = Integer.parseInt(month);
        if (mm < 1 || mm > 12) return Optional.empty();
        return Optional.of(new UnitKey(Integer.parseInt(year), mm));
    }

    private boolean inRange(int year) {
        return (startYear == null || year >= startYear) && (endYear == null || year <= endYear);
    }
}
