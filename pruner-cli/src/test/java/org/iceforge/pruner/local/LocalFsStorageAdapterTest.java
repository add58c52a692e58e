package org.iceforge.pruner.local;

import org.iceforge.pruner.storage.DeleteStatus;
import org.iceforge.pruner.storage.ListPage;
import org.iceforge.pruner.storage.PermanentStorageException;
import org.iceforge.pruner.storage.StoredObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LocalFsStorageAdapterTest {

    @TempDir
    Path baseDir;

    private void write(String key, Instant mtime) throws IOException {
        Path p = baseDir.resolve("backups").resolve(key);
        Files.createDirectories(p.getParent());
        Files.writeString(p, key);
        Files.setLastModifiedTime(p, FileTime.from(mtime));
    }

    @Test
    void list_pagesInKeyOrderUnderPrefix() throws IOException {
        Instant t = Instant.parse("2024-03-01T00:00:00Z");
        write("db/c.gz", t);
        write("db/a.gz", t.plusSeconds(10));
        write("db/b.gz", t.plusSeconds(20));
        write("other/x.gz", t);
        LocalFsStorageAdapter adapter = new LocalFsStorageAdapter(baseDir, "backups", 2);

        ListPage first = adapter.list("db/", null);
        ListPage second = adapter.list("db/", first.nextContinuationToken());

        assertThat(first.objects()).extracting(StoredObject::key).containsExactly("db/a.gz", "db/b.gz");
        assertEquals("db/b.gz", first.nextContinuationToken());
        assertThat(second.objects()).extracting(StoredObject::key).containsExactly("db/c.gz");
        assertTrue(second.isLast());
        assertEquals(t.plusSeconds(10), first.objects().get(0).lastModified());
        assertEquals("db/a.gz".length(), first.objects().get(0).size());
    }

    @Test
    void list_exactlyOnePage_isLast() throws IOException {
        write("a", Instant.now());
        write("b", Instant.now());

        ListPage page = new LocalFsStorageAdapter(baseDir, "backups", 2).list("", null);

        assertEquals(2, page.objects().size());
        assertTrue(page.isLast());
    }

    @Test
    void list_missingBucketDirectory_isEmpty() {
        ListPage page = new LocalFsStorageAdapter(baseDir, "nothing-here", 10).list("", null);

        assertTrue(page.objects().isEmpty());
        assertTrue(page.isLast());
    }

    @Test
    void delete_removesFile_thenReportsNotFound() throws IOException {
        write("db/a.gz", Instant.now());
        LocalFsStorageAdapter adapter = new LocalFsStorageAdapter(baseDir, "backups", 10);

        assertEquals(DeleteStatus.DELETED, adapter.delete("db/a.gz"));
        assertEquals(DeleteStatus.NOT_FOUND, adapter.delete("db/a.gz"));
        assertFalse(Files.exists(baseDir.resolve("backups/db/a.gz")));
    }

    @Test
    void pathTraversal_isRejected() {
        LocalFsStorageAdapter adapter = new LocalFsStorageAdapter(baseDir, "backups", 10);

        assertThrows(PermanentStorageException.class, () -> adapter.delete("../outside.gz"));
        assertThrows(PermanentStorageException.class, () -> adapter.list("../", null));
        assertThrows(IllegalArgumentException.class, () -> new LocalFsStorageAdapter(baseDir, "..", 10));
    }
}
