package org.calista.streetsense.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/**
 * ResourceIO: единая точка чтения конфига и каталога.
 *
 * <p>Locations are either {@code classpath:some/resource.json} or plain filesystem paths
 * (relative paths resolve against {@link #baseDir()} and may not escape it).
 *
 * Focus:
 * - UTF-8 by default
 * - atomic writes (tmp sibling + move) for generated config files
 * - safe resolve (anti path traversal)
 */
public final class ResourceIO {
    private static final Logger log = LogManager.getLogger(ResourceIO.class);

    public static final String CLASSPATH_PREFIX = "classpath:";

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;
    private final ClassLoader classLoader;

    public ResourceIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public ResourceIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        this.classLoader = (cl != null) ? cl : ResourceIO.class.getClassLoader();
        if (log.isDebugEnabled()) {
            log.debug("ResourceIO init: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    public Charset charset() {
        return charset;
    }

    /**
     * Резолвит относительный путь внутри baseDir и защищает от выхода через "..".
     * Absolute paths are returned normalized as-is.
     */
    public Path resolve(String path) {
        Objects.requireNonNull(path, "path");
        Path p = Paths.get(path.replace('\\', '/'));
        if (p.isAbsolute()) return p.normalize();

        Path r = baseDir.resolve(p).normalize().toAbsolutePath();
        if (!r.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + path);
        return r;
    }

    public static boolean isClasspath(String location) {
        return location != null && location.startsWith(CLASSPATH_PREFIX);
    }

    // ----------------------------
    // Read
    // ----------------------------

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public Optional<String> readClasspath(String resource) throws IOException {
        Objects.requireNonNull(resource, "resource");
        String name = resource.startsWith("/") ? resource.substring(1) : resource;
        try (InputStream in = classLoader.getResourceAsStream(name)) {
            if (in == null) return Optional.empty();
            return Optional.of(new String(in.readAllBytes(), charset));
        }
    }

    /**
     * Reads a location ({@code classpath:...} or a file path).
     *
     * @throws NoSuchFileException when nothing exists at the location
     */
    public String read(String location) throws IOException {
        Objects.requireNonNull(location, "location");
        if (isClasspath(location)) {
            String res = location.substring(CLASSPATH_PREFIX.length());
            return readClasspath(res).orElseThrow(() -> new NoSuchFileException(location));
        }
        return readString(resolve(location));
    }

    /**
     * Joins a directory location and a file name, keeping the classpath prefix.
     */
    public static String child(String dirLocation, String name) {
        Objects.requireNonNull(dirLocation, "dirLocation");
        Objects.requireNonNull(name, "name");
        if (dirLocation.isEmpty() || dirLocation.endsWith("/") || dirLocation.endsWith(":")) return dirLocation + name;
        return dirLocation + "/" + name;
    }

    // ----------------------------
    // Write
    // ----------------------------

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);

        if (!atomicWrites) {
            Files.writeString(file, content, charset, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp-" + Long.toHexString(System.nanoTime()));
        Files.writeString(tmp, content, charset, StandardOpenOption.CREATE_NEW);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("writeString: {} -> {} (ATOMIC)", tmp, file);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.trace("writeString: {} -> {} (NON-ATOMIC fallback)", tmp, file);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
