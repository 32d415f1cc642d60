package shardcache.persistence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ShardLockTest {

    @TempDir
    Path shardRoot;

    @Test
    void tryAcquire_heldByAnotherHandle_fails() throws Exception {
        ShardLock mine = new ShardLock(shardRoot.toString());
        ShardLock theirs = new ShardLock(shardRoot.toString());
        try {
            assertThat(mine.tryAcquire()).isTrue();
            assertThat(theirs.tryAcquire()).isFalse();

            mine.release();

            assertThat(theirs.tryAcquire()).isTrue();
            theirs.release();
        } finally {
            mine.close();
            theirs.close();
        }
    }

    @Test
    void tryAcquire_sameHandleTwice_failsUntilReleased() throws Exception {
        ShardLock lock = new ShardLock(shardRoot.toString());
        try {
            assertThat(lock.tryAcquire()).isTrue();
            assertThat(lock.tryAcquire()).isFalse();
            lock.release();
            assertThat(lock.tryAcquire()).isTrue();
            lock.release();
        } finally {
            lock.close();
        }
    }

    @Test
    void lockFile_livesInShardRoot() throws Exception {
        ShardLock lock = new ShardLock(shardRoot.toString());
        try {
            assertThat(lock.tryAcquire()).isTrue();
            assertThat(lock.getLockFile()).exists();
            assertThat(lock.getLockFile().getName()).isEqualTo(ShardLock.LOCK_FILENAME);
            lock.release();
        } finally {
            lock.close();
        }
    }
}
