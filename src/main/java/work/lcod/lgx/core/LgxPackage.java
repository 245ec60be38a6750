package work.lcod.lgx.core;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.lgx.archive.ArchiveEntry;
import work.lcod.lgx.archive.DeterministicTarWriter;
import work.lcod.lgx.archive.GzipCodec;
import work.lcod.lgx.archive.TarReader;
import work.lcod.lgx.manifest.Manifest;
import work.lcod.lgx.manifest.ManifestParseException;
import work.lcod.lgx.shared.ErrorKind;
import work.lcod.lgx.shared.LgxException;
import work.lcod.lgx.shared.PathNormalizer;
import work.lcod.lgx.shared.ValidationResult;

/**
 * In-memory view of an {@code .lgx} package: the manifest plus every archive entry
 * other than {@code manifest.json}, which is regenerated from the manifest on save.
 *
 * <p>Instances are independent of each other and hold no global state. They are not
 * thread-safe.
 */
public final class LgxPackage {
    public static final String MANIFEST_PATH = "manifest.json";
    public static final String VARIANTS_DIR = "variants";
    public static final String SIGNATURE_PATH = "manifest.cose";
    public static final Set<String> ALLOWED_ROOT_ENTRIES =
        Set.of(MANIFEST_PATH, SIGNATURE_PATH, VARIANTS_DIR, "docs", "licenses");

    static final String INITIAL_VERSION = "0.0.1";
    static final Set<PosixFilePermission> NEW_FILE_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private static final Logger LOG = LoggerFactory.getLogger(LgxPackage.class);

    private Manifest manifest;
    private List<ArchiveEntry> entries;

    private LgxPackage(Manifest manifest, List<ArchiveEntry> entries) {
        this.manifest = manifest;
        this.entries = entries;
    }

    /**
     * Writes a fresh package with an empty {@code variants/} directory and a
     * skeleton manifest named after the lowercased {@code name}.
     */
    public static LgxPackage create(Path outputPath, String name) {
        Objects.requireNonNull(outputPath, "outputPath");
        if (name == null || name.isBlank()) {
            throw LgxException.usage("Package name cannot be empty");
        }
        if (Files.exists(outputPath)) {
            throw LgxException.usage("File already exists: " + outputPath);
        }
        Manifest manifest = new Manifest();
        manifest.setName(name);
        manifest.normalizeName();
        manifest.setVersion(INITIAL_VERSION);

        List<ArchiveEntry> entries = new ArrayList<>();
        entries.add(ArchiveEntry.directory(VARIANTS_DIR));
        LgxPackage created = new LgxPackage(manifest, entries);
        created.save(outputPath);
        LOG.info("Created package '{}' at {}", manifest.name(), outputPath);
        return created;
    }

    public static LgxPackage load(Path path) {
        Objects.requireNonNull(path, "path");
        byte[] compressed;
        try {
            compressed = Files.readAllBytes(path);
        } catch (IOException ex) {
            throw LgxException.io("Cannot open file: " + path, ex);
        }

        List<ArchiveEntry> all = TarReader.read(GzipCodec.decompress(compressed));
        Manifest manifest = null;
        List<ArchiveEntry> rest = new ArrayList<>(all.size());
        for (ArchiveEntry entry : all) {
            if (entry.isFile() && MANIFEST_PATH.equals(entry.normalizedPath())) {
                if (manifest == null) {
                    manifest = parseManifest(entry.data());
                }
                continue;
            }
            rest.add(entry);
        }
        if (manifest == null) {
            throw new LgxException(ErrorKind.FORMAT, "Missing manifest.json");
        }
        LOG.debug("Loaded {} ({} bytes, {} entries)", path, compressed.length, rest.size());
        return new LgxPackage(manifest, rest);
    }

    /**
     * Encodes the package and replaces {@code path} with it. The archive is written to
     * a sibling temporary file first, so a failed save leaves the previous file intact.
     */
    public void save(Path path) {
        Objects.requireNonNull(path, "path");
        byte[] archive = GzipCodec.compress(encodeTar());

        Path target = path.toAbsolutePath();
        Path directory = target.getParent();
        Path temp = null;
        try {
            temp = createSibling(directory, target);
            Files.write(temp, archive);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            temp = null;
        } catch (IOException ex) {
            throw LgxException.io("Cannot write file: " + path, ex);
        } finally {
            if (temp != null) {
                deleteQuietly(temp);
            }
        }
        LOG.debug("Saved {} ({} bytes, {} entries)", path, archive.length, entries.size());
    }

    /**
     * Loads {@code path} and collects every problem found; never throws for package content.
     */
    public static ValidationResult verify(Path path) {
        LgxPackage pkg;
        try {
            pkg = load(path);
        } catch (LgxException ex) {
            return ValidationResult.failure(ex.getMessage());
        }
        return pkg.verifyContent();
    }

    ValidationResult verifyContent() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> forbiddenRoots = new LinkedHashSet<>();
        SortedSet<String> foundVariants = new TreeSet<>();
        boolean hasVariantsDir = false;

        for (ArchiveEntry entry : entries) {
            String path = entry.path();
            String root = PathNormalizer.getRootComponent(entry.normalizedPath());
            if (!ALLOWED_ROOT_ENTRIES.contains(root)) {
                forbiddenRoots.add(root);
            }
            if (!entry.kind().isWritable()) {
                errors.add("Forbidden entry type " + entry.kind().label() + ": " + path);
            }
            PathNormalizer.validateArchivePath(path).ifPresent(violation ->
                errors.add("Invalid path '" + path + "': " + violation.message()));

            if (VARIANTS_DIR.equals(root)) {
                List<String> components = PathNormalizer.splitPath(path);
                if (entry.isDirectory() || components.size() >= 2) {
                    hasVariantsDir = true;
                }
                if (components.size() == 2 && !entry.isDirectory()) {
                    errors.add("File directly under variants/: " + path);
                } else if (components.size() >= 2) {
                    foundVariants.add(PathNormalizer.toLowercase(components.get(1)));
                }
            }
            if (SIGNATURE_PATH.equals(entry.normalizedPath())) {
                warnings.add("manifest.cose is present but signatures are not checked");
            }
        }
        for (String root : forbiddenRoots) {
            errors.add("Forbidden root entry: " + root);
        }
        if (!hasVariantsDir) {
            errors.add("Missing variants/ directory");
        }
        if (!manifest.name().equals(PathNormalizer.toLowercase(manifest.name()))) {
            warnings.add("Package name '" + manifest.name() + "' is not lowercase");
        }

        ValidationResult result = new ValidationResult(errors, warnings)
            .merge(manifest.validate(), "Manifest: ")
            .merge(manifest.validateCompleteness(foundVariants), "");

        List<String> unresolved = new ArrayList<>();
        manifest.main().forEach((variant, mainPath) -> {
            String full = VARIANTS_DIR + "/" + variant + "/" + mainPath;
            if (findFile(full).isEmpty()) {
                unresolved.add("main[" + variant + "] points to non-existent file: " + mainPath);
            }
        });
        return result.merge(new ValidationResult(unresolved, List.of()), "");
    }

    /**
     * Replaces the whole content of {@code variant} with {@code source} and records
     * its main path. A directory source needs {@code mainPath}; a single file
     * defaults it to the file name. Nothing changes unless every step succeeds.
     *
     * @return {@code true} when an existing variant was replaced
     */
    public boolean addVariant(String variant, Path source, String mainPath) {
        VariantName name = VariantName.of(variant);
        Objects.requireNonNull(source, "source");
        if (!Files.exists(source, LinkOption.NOFOLLOW_LINKS)) {
            throw LgxException.usage("Path does not exist: " + source);
        }

        boolean directory = Files.isDirectory(source);
        String resolvedMain;
        if (mainPath != null) {
            resolvedMain = mainPath;
        } else if (directory) {
            throw LgxException.usage("--main is required when adding a directory");
        } else {
            resolvedMain = source.getFileName().toString();
        }
        resolvedMain = PathNormalizer.toNfc(resolvedMain)
            .orElseThrow(() -> LgxException.validation("Main path is not valid Unicode"));
        String checkedMain = resolvedMain;
        PathNormalizer.validateArchivePath(checkedMain).ifPresent(violation -> {
            throw LgxException.validation("Invalid main path '" + checkedMain + "': " + violation.message());
        });

        List<ArchiveEntry> staged = new ArrayList<>();
        staged.add(ArchiveEntry.directory(name.directory()));
        if (directory) {
            stageDirectory(name, source, staged);
        } else {
            staged.add(ArchiveEntry.file(archivePath(name, source.getFileName().toString()), readFile(source)));
        }

        boolean replaced = hasVariant(name.value());
        List<ArchiveEntry> next = new ArrayList<>(entries.size() + staged.size());
        for (ArchiveEntry entry : entries) {
            if (!belongsTo(entry, name)) {
                next.add(entry);
            }
        }
        next.addAll(staged);

        Manifest updated = manifest.copy();
        updated.setMain(name.value(), resolvedMain);
        entries = next;
        manifest = updated;
        LOG.info("{} variant '{}' from {} ({} entries, main {})",
            replaced ? "Replaced" : "Added", name, source, staged.size(), resolvedMain);
        return replaced;
    }

    public void removeVariant(String variant) {
        VariantName name = VariantName.parse(variant)
            .filter(candidate -> hasVariant(candidate.value()))
            .orElseThrow(() -> LgxException.usage("Variant does not exist: " + variant));
        entries = entries.stream()
            .filter(entry -> !belongsTo(entry, name))
            .collect(Collectors.toCollection(ArrayList::new));
        manifest.removeMain(name.value());
        LOG.info("Removed variant '{}'", name);
    }

    /**
     * True if any entry is {@code variants/<variant>} or lies beneath it. Invalid
     * names are simply absent.
     */
    public boolean hasVariant(String variant) {
        Optional<VariantName> name = VariantName.parse(variant);
        return name.isPresent() && entries.stream().anyMatch(entry -> belongsTo(entry, name.get()));
    }

    /**
     * Variant names derived from the entries under {@code variants/}, lowercased and sorted.
     */
    public SortedSet<String> variants() {
        SortedSet<String> found = new TreeSet<>();
        for (ArchiveEntry entry : entries) {
            List<String> components = PathNormalizer.splitPath(entry.path());
            if (components.size() < 2 || !VARIANTS_DIR.equals(components.get(0))) {
                continue;
            }
            if (components.size() == 2 && !entry.isDirectory()) {
                continue;
            }
            found.add(PathNormalizer.toLowercase(components.get(1)));
        }
        return Collections.unmodifiableSortedSet(found);
    }

    /**
     * True only when {@code variant} already has a main path that differs from {@code candidate}.
     */
    public boolean wouldMainChange(String variant, String candidate) {
        return manifest.getMain(variant).map(current -> !current.equals(candidate)).orElse(false);
    }

    /**
     * Writes every entry of {@code variant} below {@code outputDir/<variant>/}.
     */
    public void extractVariant(String variant, Path outputDir) {
        VariantName name = VariantName.parse(variant)
            .filter(candidate -> hasVariant(candidate.value()))
            .orElseThrow(() -> LgxException.usage("Variant does not exist: " + variant));
        Path base = outputDir.resolve(name.value()).toAbsolutePath().normalize();
        String prefix = name.prefix();
        int written = 0;
        try {
            Files.createDirectories(base);
            for (ArchiveEntry entry : entries) {
                String normalized = entry.normalizedPath();
                if (!normalized.startsWith(prefix)) {
                    continue;
                }
                String relative = normalized.substring(prefix.length());
                Path target = resolveInside(base, relative);
                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else if (entry.isFile()) {
                    Files.createDirectories(target.getParent());
                    Files.write(target, entry.data());
                    written++;
                } else {
                    throw LgxException.validation("Refusing to extract " + entry.kind().label() + ": " + entry.path());
                }
            }
        } catch (IOException ex) {
            throw LgxException.io("Cannot extract variant '" + name + "' to " + base, ex);
        }
        LOG.debug("Extracted variant '{}' to {} ({} files)", name, base, written);
    }

    /**
     * Extracts every variant in name order; the first failure aborts.
     */
    public void extractAll(Path outputDir) {
        for (String variant : variants()) {
            extractVariant(variant, outputDir);
        }
    }

    /**
     * Live manifest; edits to it are persisted by the next {@link #save(Path)}.
     */
    public Manifest manifest() {
        return manifest;
    }

    public List<ArchiveEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    byte[] encodeTar() {
        DeterministicTarWriter writer = new DeterministicTarWriter();
        writer.addFile(MANIFEST_PATH, manifest.toJson().getBytes(StandardCharsets.UTF_8));

        Set<String> directories = new LinkedHashSet<>();
        directories.add(VARIANTS_DIR);
        for (ArchiveEntry entry : entries) {
            String normalized = entry.normalizedPath();
            for (String parent = PathNormalizer.dirname(normalized); !parent.isEmpty() && !"/".equals(parent);
                 parent = PathNormalizer.dirname(parent)) {
                directories.add(parent);
            }
            if (entry.isDirectory()) {
                directories.add(normalized);
            } else if (!MANIFEST_PATH.equals(normalized)) {
                writer.addEntry(entry);
            }
        }
        for (String directory : directories) {
            if (!directory.isEmpty()) {
                writer.addDirectory(directory);
            }
        }
        return writer.finish();
    }

    private void stageDirectory(VariantName name, Path source, List<ArchiveEntry> staged) {
        try {
            // the walk never follows links, so a linked root is resolved up front
            Path root = source.toRealPath();
            Files.walkFileTree(root, new StagingVisitor(name, root, staged));
        } catch (IOException ex) {
            throw LgxException.io("Cannot read directory: " + source, ex);
        }
    }

    private static String archivePath(VariantName name, String relative) {
        String path = PathNormalizer.toNfc(name.prefix() + relative)
            .orElseThrow(() -> LgxException.validation("Failed to normalize path: " + relative));
        PathNormalizer.validateArchivePath(path).ifPresent(violation -> {
            throw LgxException.validation("Invalid archive path '" + path + "': " + violation.message());
        });
        return path;
    }

    private static String relativeArchivePath(Path root, Path child) {
        List<String> parts = new ArrayList<>();
        for (Path part : root.relativize(child)) {
            parts.add(part.toString());
        }
        return PathNormalizer.joinPath(parts);
    }

    private static byte[] readFile(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw LgxException.io("Cannot read file: " + file, ex);
        }
    }

    private static Path resolveInside(Path base, String relative) {
        PathNormalizer.validateArchivePath(relative).ifPresent(violation -> {
            throw LgxException.validation("Unsafe entry path '" + relative + "': " + violation.message());
        });
        Path target = base.resolve(relative).normalize();
        if (!target.startsWith(base)) {
            throw LgxException.validation("Entry escapes the output directory: " + relative);
        }
        return target;
    }

    private static boolean belongsTo(ArchiveEntry entry, VariantName name) {
        String normalized = entry.normalizedPath();
        return normalized.equals(name.directory()) || normalized.startsWith(name.prefix());
    }

    private Optional<ArchiveEntry> findFile(String path) {
        return entries.stream()
            .filter(entry -> entry.isFile() && entry.normalizedPath().equals(path))
            .findFirst();
    }

    private static Manifest parseManifest(byte[] data) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(data)).toString();
        } catch (CharacterCodingException ex) {
            throw new ManifestParseException("Failed to parse manifest: not valid UTF-8", null, ex);
        }
        try {
            return Manifest.parse(text);
        } catch (ManifestParseException ex) {
            throw new ManifestParseException("Failed to parse manifest: " + ex.getMessage(), ex.field().orElse(null), ex);
        }
    }

    /**
     * Temporary file that ends up with the permissions of the file it replaces, or
     * {@code rw-r--r--} minus the umask for a new package.
     */
    private static Path createSibling(Path directory, Path target) throws IOException {
        String prefix = "." + target.getFileName();
        if (!directory.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return Files.createTempFile(directory, prefix, ".tmp");
        }
        if (!Files.exists(target)) {
            return Files.createTempFile(directory, prefix, ".tmp",
                PosixFilePermissions.asFileAttribute(NEW_FILE_PERMISSIONS));
        }
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(target);
        Path temp = Files.createTempFile(directory, prefix, ".tmp");
        try {
            Files.setPosixFilePermissions(temp, permissions);
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw ex;
        }
        return temp;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException ex) {
            LOG.warn("Unable to delete temporary file {}: {}", path, ex.getMessage());
        }
    }

    private static final class StagingVisitor extends SimpleFileVisitor<Path> {
        private final VariantName name;
        private final Path root;
        private final List<ArchiveEntry> staged;

        StagingVisitor(VariantName name, Path root, List<ArchiveEntry> staged) {
            this.name = name;
            this.root = root;
            this.staged = staged;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!Objects.equals(dir, root)) {
                staged.add(ArchiveEntry.directory(archivePath(name, relativeArchivePath(root, dir))));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
            if (!attrs.isRegularFile()) {
                LOG.warn("Skipping {} (not a regular file)", file);
                return FileVisitResult.CONTINUE;
            }
            staged.add(ArchiveEntry.file(archivePath(name, relativeArchivePath(root, file)), Files.readAllBytes(file)));
            return FileVisitResult.CONTINUE;
        }
    }
}
