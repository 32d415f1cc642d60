package shardcache.persistence;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import shardcache.CacheConfig;
import shardcache.CacheError;
import shardcache.CacheItem;
import shardcache.CacheResult;
import shardcache.ShardRouter;
import shardcache.partition.HashModScheme;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BerkDBCacheTest {

    @TempDir
    Path dir;

    private ManualClock clock;
    private ShardRouter cache;

    private ShardRouter open(CacheConfig conf) throws Exception {
        return new ShardRouter(dir.toString(), conf, new JavaBerkDB(), new HashModScheme(), clock);
    }

    private static CacheConfig conf() {
        return new CacheConfig().setShardCount(4).setTimeoutBudget(5).setInlineSizeThreshold(16);
    }

    private int blobFiles() {
        return FileUtils.listFiles(dir.toFile(), new String[]{"val"}, true).size();
    }

    private static byte[] payload(int size) {
        byte[] bytes = new byte[size];
        for (int i = 0; i < size; i++) {
            bytes[i] = (byte) (i * 31);
        }
        return bytes;
    }

    @BeforeEach
    void setUp() throws Exception {
        clock = new ManualClock(1_700_000_000_000L);
        cache = open(conf());
    }

    @AfterEach
    void tearDown() throws Exception {
        cache.close();
    }

    @Nested
    class Values {
        @Test
        void get_afterSet_returnsEachKind() {
            List<String> list = new ArrayList<String>(Arrays.asList("x", "y"));
            cache.set("long", 12L, null).get();
            cache.set("int", 7, null).get();
            cache.set("text", "héllo", null).get();
            cache.set("bytes", new byte[]{1, 2, 3}, null).get();
            cache.set("object", list, null).get();

            assertThat(cache.get("long").get()).isEqualTo(12L);
            assertThat(cache.get("int").get()).isEqualTo(7);
            assertThat(cache.get("text").get()).isEqualTo("héllo");
            assertThat((byte[]) cache.get("bytes").get()).containsExactly(1, 2, 3);
            assertThat(cache.get("object").get()).isEqualTo(list);
        }

        @Test
        void get_missingKey_returnsDefault() {
            assertThat(cache.get("nope").get()).isNull();
            assertThat(cache.get("nope", "fallback").get()).isEqualTo("fallback");
        }

        @Test
        void set_overwrites() {
            cache.set("k", "one", null).get();
            cache.set("k", "two", null).get();

            assertThat(cache.get("k").get()).isEqualTo("two");
        }

        @Test
        void set_largeValue_roundTripsThroughBlob() {
            byte[] big = payload(100_000);

            cache.set("big", big, null).get();

            assertThat(blobFiles()).isEqualTo(1);
            assertThat((byte[]) cache.get("big").get()).isEqualTo(big);
        }

        @Test
        void get_withMetadata_returnsItem() {
            cache.set("k", "v", Duration.ofSeconds(30), false, "group", true).get();

            CacheItem item = (CacheItem) cache.get("k", null, false, true, true, true).get();

            assertThat(item.getValue()).isEqualTo("v");
            assertThat(item.getExpireTime()).isEqualTo(clock.millis() + 30_000);
            assertThat(item.getTag()).isEqualTo("group");
        }

        @Test
        void get_withMetadataOnMiss_returnsDefaultWithoutMetadata() {
            CacheItem item = (CacheItem) cache.get("k", "d", false, true, true, true).get();

            assertThat(item.getValue()).isEqualTo("d");
            assertThat(item.getExpireTime()).isNull();
            assertThat(item.getTag()).isNull();
        }

        @Test
        void add_existingLiveKey_isRefused() {
            assertThat(cache.add("k", "first", null).get()).isTrue();
            assertThat(cache.add("k", "second", null).get()).isFalse();

            assertThat(cache.get("k").get()).isEqualTo("first");
        }

        @Test
        void add_refusedLargeValue_leavesNoBlobBehind() {
            cache.add("k", payload(500), null).get();

            assertThat(cache.add("k", payload(600), null).get()).isFalse();

            assertThat(blobFiles()).isEqualTo(1);
        }

        @Test
        void delete_reportsWhetherKeyWasLive() {
            cache.set("k", "v", null).get();

            assertThat(cache.delete("k").get()).isTrue();
            assertThat(cache.delete("k").get()).isFalse();
            assertThat(cache.contains("k").get()).isFalse();
        }

        @Test
        void delete_largeValue_removesBlob() {
            cache.set("big", payload(4096), null).get();

            cache.delete("big").get();

            assertThat(blobFiles()).isZero();
        }

        @Test
        void pop_returnsAndRemoves() {
            cache.set("k", "v", null).get();

            assertThat(cache.pop("k", null, true).get()).isEqualTo("v");
            assertThat(cache.pop("k", "gone", true).get()).isEqualTo("gone");
            assertThat(cache.contains("k").get()).isFalse();
        }

        @Test
        void volume_countsStoredBytes() {
            long before = cache.volume().get();

            cache.set("big", payload(200_000), null).get();

            assertThat(cache.volume().get()).isGreaterThan(before + 150_000);
        }
    }

    @Nested
    class Expiry {
        @Test
        void get_afterTtlElapses_misses() {
            cache.set("k", "v", Duration.ofSeconds(10)).get();
            clock.advance(Duration.ofSeconds(9));
            assertThat(cache.get("k").get()).isEqualTo("v");

            clock.advance(Duration.ofSeconds(1));

            assertThat(cache.get("k", "expired").get()).isEqualTo("expired");
            assertThat(cache.contains("k").get()).isFalse();
        }

        @Test
        void set_zeroTtl_isImmediatelyExpired() {
            cache.set("k", "v", Duration.ZERO).get();

            assertThat(cache.contains("k").get()).isFalse();
            assertThat(cache.get("k").get()).isNull();
        }

        @Test
        void add_overExpiredKey_succeeds() {
            cache.set("k", "old", Duration.ofSeconds(1)).get();
            clock.advance(Duration.ofSeconds(2));

            assertThat(cache.add("k", "new", null).get()).isTrue();
            assertThat(cache.get("k").get()).isEqualTo("new");
        }

        @Test
        void delete_expiredKey_reportsFalse() {
            cache.set("k", "v", Duration.ofSeconds(1)).get();
            clock.advance(Duration.ofSeconds(5));

            assertThat(cache.delete("k").get()).isFalse();
        }

        @Test
        void expire_removesOnlyExpiredEntries() {
            for (int i = 0; i < 30; i++) {
                cache.set("short-" + i, i, Duration.ofSeconds(5)).get();
            }
            cache.set("long", 1, Duration.ofHours(1)).get();
            cache.set("forever", 2, null).get();
            clock.advance(Duration.ofMinutes(1));

            assertThat(cache.expire().get()).isEqualTo(30);
            assertThat(cache.expire().get()).isZero();
            assertThat(cache.contains("long").get()).isTrue();
            assertThat(cache.contains("forever").get()).isTrue();
        }

        @Test
        void expire_removesBlobsOfExpiredEntries() {
            cache.set("big", payload(2048), Duration.ofSeconds(1)).get();
            clock.advance(Duration.ofSeconds(2));

            cache.expire().get();

            assertThat(blobFiles()).isZero();
        }

        @Test
        void touch_extendsLiveEntry() {
            cache.set("k", "v", Duration.ofSeconds(5)).get();

            assertThat(cache.touch("k", Duration.ofMinutes(10), true).get()).isTrue();
            clock.advance(Duration.ofMinutes(1));

            assertThat(cache.get("k").get()).isEqualTo("v");
        }

        @Test
        void touch_nullTtl_removesExpiry() {
            cache.set("k", "v", Duration.ofSeconds(5)).get();

            cache.touch("k", null, true).get();
            clock.advance(Duration.ofDays(1));

            assertThat(cache.contains("k").get()).isTrue();
        }

        @Test
        void set_ttlTooLongToAdd_neverExpires() {
            cache.set("millis", "v", Duration.ofMillis(Long.MAX_VALUE)).get();
            cache.set("seconds", "v", Duration.ofSeconds(Long.MAX_VALUE)).get();
            clock.advance(Duration.ofDays(365_000));

            assertThat(cache.get("millis").get()).isEqualTo("v");
            assertThat(cache.contains("seconds").get()).isTrue();
            assertThat(cache.expire().get()).isZero();
        }

        @Test
        void touch_ttlTooLongToAdd_neverExpires() {
            cache.set("k", "v", Duration.ofSeconds(1)).get();

            assertThat(cache.touch("k", Duration.ofSeconds(Long.MAX_VALUE), true).get()).isTrue();
            clock.advance(Duration.ofDays(1));

            assertThat(cache.get("k").get()).isEqualTo("v");
        }

        @Test
        void set_negativeTtlAtEpoch_isExpired() throws Exception {
            cache.close();
            clock = new ManualClock(0L);
            cache = open(conf());

            cache.set("k", "v", Duration.ofMillis(-1)).get();

            assertThat(cache.get("k").get()).isNull();
            assertThat(cache.contains("k").get()).isFalse();
        }

        @Test
        void touch_missingKey_reportsFalse() {
            assertThat(cache.touch("nope", Duration.ofSeconds(5), true).get()).isFalse();
        }
    }

    @Nested
    class Counters {
        @Test
        void incr_missingKeyWithoutDefault_isKeyNotFound() {
            CacheResult<Long> ret = cache.incr("hits");

            assertThat(ret.error()).isEqualTo(CacheError.KEY_NOT_FOUND);
            assertThat(cache.contains("hits").get()).isFalse();
        }

        @Test
        void incr_missingKeyWithDefault_seedsCounter() {
            assertThat(cache.incr("hits", 1, 0L, true).get()).isEqualTo(1L);
            assertThat(cache.incr("hits", 5, 0L, true).get()).isEqualTo(6L);
            assertThat(cache.get("hits").get()).isEqualTo(6L);
        }

        @Test
        void incr_valueSetAsInteger_counts() {
            cache.set("n", 41, null).get();

            assertThat(cache.incr("n").get()).isEqualTo(42L);
            assertThat(cache.get("n").get()).isEqualTo(42);
        }

        @Test
        void get_narrowIntegers_keepTheirType() {
            cache.set("s", (short) -3, null).get();
            cache.set("b", (byte) 9, null).get();

            assertThat(cache.get("s").get()).isInstanceOf(Short.class).isEqualTo((short) -3);
            assertThat(cache.get("b").get()).isInstanceOf(Byte.class).isEqualTo((byte) 9);
            assertThat(cache.incr("b", 1, null, true).get()).isEqualTo(10L);
            assertThat(cache.get("b").get()).isEqualTo((byte) 10);
        }

        @Test
        void incr_pastIntegerRange_widensToLong() {
            cache.set("n", Integer.MAX_VALUE, null).get();

            assertThat(cache.incr("n").get()).isEqualTo(Integer.MAX_VALUE + 1L);
            assertThat(cache.get("n").get()).isEqualTo(Integer.MAX_VALUE + 1L);
        }

        @Test
        void decr_goesBelowZero() {
            cache.set("n", 1L, null).get();

            assertThat(cache.decr("n", 3, null, true).get()).isEqualTo(-2L);
        }

        @Test
        void incr_keepsExpiryAndTag() {
            cache.set("n", 1L, Duration.ofSeconds(10), false, "t", true).get();

            cache.incr("n").get();
            CacheItem item = (CacheItem) cache.get("n", null, false, true, true, true).get();

            assertThat(item.getValue()).isEqualTo(2L);
            assertThat(item.getExpireTime()).isEqualTo(clock.millis() + 10_000);
            assertThat(item.getTag()).isEqualTo("t");
        }

        @Test
        void incr_expiredCounter_isKeyNotFound() {
            cache.set("n", 5L, Duration.ofSeconds(1)).get();
            clock.advance(Duration.ofSeconds(2));

            assertThat(cache.incr("n").error()).isEqualTo(CacheError.KEY_NOT_FOUND);
        }

        @Test
        void incr_nonIntegerValue_isRejected() {
            cache.set("s", "text", null).get();

            assertThatThrownBy(new ThrowingCallable() {
                public void call() throws Throwable {
                    cache.incr("s");
                }
            }).isInstanceOf(IllegalStateException.class);
            assertThat(cache.get("s").get()).isEqualTo("text");
        }

        @Test
        void incr_overflow_isRejected() {
            cache.set("n", Long.MAX_VALUE, null).get();

            assertThatThrownBy(new ThrowingCallable() {
                public void call() throws Throwable {
                    cache.incr("n");
                }
            }).isInstanceOf(ArithmeticException.class);
        }
    }

    @Nested
    class Tags {
        private void fill() {
            for (int i = 0; i < 12; i++) {
                cache.set("a-" + i, i, null, false, "a", true).get();
            }
            cache.set("b-0", "b", null, false, "b", true).get();
            cache.set("plain", "p", null).get();
        }

        @Test
        void evict_withoutIndex_removesTaggedEntries() {
            fill();

            assertThat(cache.evict("a").get()).isEqualTo(12);
            assertThat(cache.contains("a-3").get()).isFalse();
            assertThat(cache.contains("b-0").get()).isTrue();
            assertThat(cache.contains("plain").get()).isTrue();
        }

        @Test
        void evict_withIndex_removesTaggedEntries() {
            cache.createTagIndex().get();
            fill();

            assertThat(cache.evict("a").get()).isEqualTo(12);
            assertThat(cache.evict("a").get()).isZero();
            assertThat(cache.contains("b-0").get()).isTrue();
        }

        @Test
        void createTagIndex_indexesExistingEntries() {
            fill();

            cache.createTagIndex().get();

            assertThat(cache.evict("b").get()).isEqualTo(1);
        }

        @Test
        void dropTagIndex_evictFallsBackToScan() {
            cache.createTagIndex().get();
            fill();

            cache.dropTagIndex().get();

            assertThat(cache.evict("a").get()).isEqualTo(12);
        }

        @Test
        void evict_removesBlobsOfEvictedEntries() {
            cache.set("big", payload(1000), null, false, "heavy", true).get();

            cache.evict("heavy").get();

            assertThat(blobFiles()).isZero();
        }

        @Test
        void evict_nullTag_isRejected() {
            assertThatThrownBy(new ThrowingCallable() {
                public void call() throws Throwable {
                    cache.evict(null);
                }
            }).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Clearing {
        @Test
        void clear_removesEverythingAcrossBatches() throws Exception {
            cache.close();
            cache = open(conf().setSweepBatchSize(3));
            for (int i = 0; i < 40; i++) {
                cache.set("k" + i, i, null).get();
            }
            cache.set("big", payload(1000), null).get();

            assertThat(cache.clear().get()).isEqualTo(41);
            assertThat(cache.contains("k7").get()).isFalse();
            assertThat(blobFiles()).isZero();
        }

        @Test
        void clear_emptyCache_removesNothing() {
            assertThat(cache.clear().get()).isZero();
        }
    }

    @Nested
    class Streams {
        @Test
        void openStream_readsLargeValue() throws Exception {
            byte[] big = payload(50_000);
            cache.set("big", big, null).get();

            InputStream in = cache.openStream("big").get();
            try {
                assertThat(IOUtils.toByteArray(in)).isEqualTo(big);
            } finally {
                in.close();
            }
        }

        @Test
        void openStream_readsInlineValue() throws Exception {
            cache.set("small", new byte[]{9, 8}, null).get();

            InputStream in = cache.openStream("small").get();
            try {
                assertThat(IOUtils.toByteArray(in)).containsExactly(9, 8);
            } finally {
                in.close();
            }
        }

        @Test
        void openStream_missingKey_isKeyNotFound() {
            assertThat(cache.openStream("nope").error()).isEqualTo(CacheError.KEY_NOT_FOUND);
        }

        @Test
        void set_fromStream_storesBytes() throws Exception {
            byte[] big = payload(70_000);

            cache.set("s", new ByteArrayInputStream(big), null, true, null, true).get();

            assertThat((byte[]) cache.get("s").get()).isEqualTo(big);
            InputStream in = (InputStream) cache.get("s", null, true, false, false, true).get();
            try {
                assertThat(IOUtils.toByteArray(in)).isEqualTo(big);
            } finally {
                in.close();
            }
        }

        @Test
        void openStream_survivesOverwriteUntilClosed() throws Exception {
            byte[] big = payload(30_000);
            cache.set("k", big, null).get();
            InputStream in = cache.openStream("k").get();

            cache.set("k", "replacement", null).get();

            assertThat(blobFiles()).isEqualTo(1);
            assertThat(IOUtils.toByteArray(in)).isEqualTo(big);
            in.close();
            assertThat(blobFiles()).isZero();
            assertThat(cache.get("k").get()).isEqualTo("replacement");
        }
    }

    @Nested
    class Lifecycle {
        @Test
        void reopen_keepsEntries() throws Exception {
            cache.set("k", "persisted", null).get();
            cache.set("big", payload(5000), null).get();
            cache.close();

            cache = open(conf());

            assertThat(cache.get("k").get()).isEqualTo("persisted");
            assertThat((byte[]) cache.get("big").get()).isEqualTo(payload(5000));
        }

        @Test
        void reopen_differentShardCount_isRejected() throws Exception {
            cache.close();

            assertThatThrownBy(new ThrowingCallable() {
                public void call() throws Throwable {
                    open(conf().setShardCount(6));
                }
            }).isInstanceOf(IllegalArgumentException.class);

            cache = open(conf());
        }

        @Test
        void operations_afterClose_areClosed() throws Exception {
            cache.close();

            assertThat(cache.isClosed()).isTrue();
            assertThat(cache.get("k").error()).isEqualTo(CacheError.CLOSED);
            assertThat(cache.set("k", "v", null).error()).isEqualTo(CacheError.CLOSED);
            assertThat(cache.incr("k").error()).isEqualTo(CacheError.CLOSED);
            assertThat(cache.expire().error()).isEqualTo(CacheError.CLOSED);
            assertThat(cache.clear().error()).isEqualTo(CacheError.CLOSED);
            cache.close();
        }

        @Test
        void shards_eachHaveTheirOwnDirectory() {
            for (int i = 0; i < cache.getShardCount(); i++) {
                assertThat(new File(dir.toFile(), String.valueOf(i))).isDirectory();
            }
            assertThat(cache.getShardCount()).isEqualTo(4);
        }

        @Test
        void open_withTagIndexEnabled_createsIndex() throws Exception {
            cache.close();
            cache = open(conf().setTagIndexEnabled(true));
            cache.set("k", "v", null, false, "t", true).get();

            assertThat(cache.evict("t").get()).isEqualTo(1);
        }
    }
}
