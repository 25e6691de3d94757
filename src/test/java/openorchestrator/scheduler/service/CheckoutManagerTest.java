package openorchestrator.scheduler.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CheckoutManagerTest {

    @TempDir
    Path tmp;

    @Test
    void entryPointDepthFirstInNameOrder() throws Exception {
        Path repo = tmp.resolve("repo");
        Files.createDirectories(repo.resolve("b"));
        Files.createDirectories(repo.resolve("a/deep"));
        Files.writeString(repo.resolve("main.py"), "root");
        Files.writeString(repo.resolve("b/main.py"), "b");
        Files.writeString(repo.resolve("a/deep/main.py"), "a-deep");

        CheckoutManager checkouts = new CheckoutManager(tmp.resolve("root"), "git");
        Optional<Path> found = checkouts.findEntryPoint(repo, "main.py");

        assertTrue(found.isPresent());
        assertEquals(repo.resolve("a/deep/main.py"), found.get());
    }

    @Test
    void gitDirectoryIsSkipped() throws Exception {
        Path repo = tmp.resolve("repo");
        Files.createDirectories(repo.resolve(".git"));
        Files.writeString(repo.resolve(".git/main.py"), "");

        CheckoutManager checkouts = new CheckoutManager(tmp.resolve("root"), "git");

        assertTrue(checkouts.findEntryPoint(repo, "main.py").isEmpty());
    }

    @Test
    void clearAllEmptiesRoot() throws Exception {
        Path root = tmp.resolve("root");
        Files.createDirectories(root.resolve("one/nested"));
        Files.writeString(root.resolve("one/nested/file.txt"), "x");
        Files.createDirectories(root.resolve("two"));

        CheckoutManager checkouts = new CheckoutManager(root, "git");
        checkouts.clearAll();

        assertTrue(Files.isDirectory(root));
        try (var children = Files.list(root)) {
            assertEquals(0, children.count());
        }
    }

    @Test
    void failedCloneLeavesNoFolder() throws Exception {
        Path root = tmp.resolve("root");
        CheckoutManager checkouts = new CheckoutManager(root, "git");

        assertThrows(LaunchException.class,
                () -> checkouts.checkout(tmp.resolve("no-such-repo").toString(), null));

        try (var children = Files.list(root)) {
            assertEquals(0, children.count());
        }
    }
}
