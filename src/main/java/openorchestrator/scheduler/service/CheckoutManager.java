package openorchestrator.scheduler.service;

import openorchestrator.scheduler.config.SchedulerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Git checkouts for triggers whose process lives in a repository.
 * Every checkout gets its own folder under the configured root; the root is
 * wiped whenever the scheduler has no jobs left.
 */
public class CheckoutManager {

    private static final Logger log = LoggerFactory.getLogger(CheckoutManager.class);

    private final Path root;
    private final String gitExecutable;

    public CheckoutManager(SchedulerConfig config) {
        this(config.checkoutRoot(), config.gitExecutable());
    }

    public CheckoutManager(Path root, String gitExecutable) {
        this.root = root;
        this.gitExecutable = gitExecutable;
    }

    public Path root() {
        return root;
    }

    /**
     * Clone a repository into a fresh folder.
     *
     * @param url    repository URL
     * @param branch branch to check out, or null for the remote default
     * @return the folder holding the checkout
     * @throws LaunchException if git is missing or the clone fails; the folder is removed
     */
    public Path checkout(String url, String branch) throws LaunchException {
        Path folder = root.resolve(UUID.randomUUID().toString());

        List<String> command = new ArrayList<>();
        command.add(gitExecutable);
        command.add("clone");
        if (branch != null && !branch.isBlank()) {
            command.add("-b");
            command.add(branch);
        }
        command.add(url);
        command.add(folder.toString());

        try {
            Files.createDirectories(root);

            ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
            pb.environment().put("GIT_TERMINAL_PROMPT", "0");
            Process p = pb.start();
            p.getOutputStream().close();
            byte[] out = p.getInputStream().readAllBytes();
            int exit = p.waitFor();

            if (exit != 0) {
                delete(folder);
                throw new LaunchException("git clone of " + url + " exited with code " + exit + ":\n"
                        + new String(out, StandardCharsets.UTF_8).trim());
            }
        } catch (IOException e) {
            delete(folder);
            throw new LaunchException("Could not run git clone of " + url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            delete(folder);
            throw new LaunchException("Interrupted while cloning " + url, e);
        }

        log.info("Cloned {} into {}", url, folder);
        return folder;
    }

    /**
     * First regular file named {@code fileName} in a depth-first walk of
     * {@code folder}, visiting entries of each directory in name order.
     * The {@code .git} directory is not searched.
     */
    public Optional<Path> findEntryPoint(Path folder, String fileName) throws LaunchException {
        try {
            return search(folder, fileName);
        } catch (IOException e) {
            throw new LaunchException("Could not search " + folder + " for " + fileName, e);
        }
    }

    private Optional<Path> search(Path dir, String fileName) throws IOException {
        List<Path> entries;
        try (Stream<Path> children = Files.list(dir)) {
            entries = children.sorted(Comparator.comparing(p -> p.getFileName().toString())).toList();
        }
        for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (Files.isDirectory(entry)) {
                if (".git".equals(name)) {
                    continue;
                }
                Optional<Path> found = search(entry, fileName);
                if (found.isPresent()) {
                    return found;
                }
            } else if (name.equals(fileName) && Files.isRegularFile(entry)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * Remove a checkout folder. Failures are logged, not raised.
     */
    public void delete(Path folder) {
        if (folder == null || !Files.exists(folder)) {
            return;
        }
        try {
            deleteRecursively(folder);
            log.debug("Deleted checkout {}", folder);
        } catch (IOException e) {
            log.warn("Could not delete checkout {}: {}", folder, e.getMessage());
        }
    }

    /**
     * Wipe everything under the checkout root. Best effort: leftovers that cannot
     * be removed (open files on some platforms) are retried on the next call.
     */
    public void clearAll() {
        if (!Files.isDirectory(root)) {
            return;
        }
        try (Stream<Path> children = Files.list(root)) {
            for (Path child : children.toList()) {
                try {
                    deleteRecursively(child);
                } catch (IOException e) {
                    log.debug("Could not clear {}: {}", child, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.debug("Could not list checkout root {}: {}", root, e.getMessage());
        }
    }

    private static void deleteRecursively(Path path) throws IOException {
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(path)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path p : paths) {
            // git marks pack files read-only
            p.toFile().setWritable(true);
            Files.deleteIfExists(p);
        }
    }
}
