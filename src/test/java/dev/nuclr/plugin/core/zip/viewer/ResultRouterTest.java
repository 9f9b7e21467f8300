package dev.nuclr.plugin.core.zip.viewer;

import dev.nuclr.plugin.core.zip.viewer.cache.CacheKey;
import dev.nuclr.plugin.core.zip.viewer.cache.DecodedImage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

class ResultRouterTest {

    private static final Path ZIP = Path.of("router.zip");
    private static final CacheKey KEY_A = CacheKey.original(ZIP, "a.png");
    private static final CacheKey KEY_B = CacheKey.original(ZIP, "b.png");

    private ResultRouter router;
    private List<LoadResult> shown;
    private ConsumerCursor viewer;

    @BeforeEach
    void setUp() {
        router = new ResultRouter();
        shown = new ArrayList<>();
        viewer = router.register(new ConsumerCursor("viewer", shown::add));
    }

    private static LoadResult success(CacheKey key) {
        return LoadResult.success(key, new DecodedImage(new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB)));
    }

    @Test
    void resultForExpectedKey_isDelivered() {
        viewer.expect(KEY_A);
        LoadResult result = success(KEY_A);

        router.publish(result);
        int delivered = router.drain();

        assertThat(delivered).isEqualTo(1);
        assertThat(shown).containsExactly(result);
        assertThat(router.deliveredCount()).isEqualTo(1);
    }

    @Test
    void resultArrivingAfterCursorMoved_isDropped() {
        viewer.expect(KEY_A);
        viewer.expect(KEY_B);

        router.publish(success(KEY_A));
        router.drain();

        assertThat(shown).isEmpty();
        assertThat(router.droppedCount()).isEqualTo(1);
    }

    @Test
    void clearedCursor_receivesNothing() {
        viewer.expect(KEY_A);
        viewer.clear();

        router.publish(success(KEY_A));
        router.drain();

        assertThat(viewer.expectedKey()).isNull();
        assertThat(shown).isEmpty();
    }

    @Test
    void everyMatchingCursorGetsTheResult() {
        List<LoadResult> gallery = new ArrayList<>();
        ConsumerCursor galleryCursor = router.register(new ConsumerCursor("gallery", gallery::add));
        viewer.expect(KEY_A);
        galleryCursor.expect(KEY_A);

        router.publish(success(KEY_A));
        router.drain();

        assertThat(shown).hasSize(1);
        assertThat(gallery).hasSize(1);
    }

    @Test
    void unregisteredCursor_isSkipped() {
        viewer.expect(KEY_A);
        router.unregister(viewer);

        router.publish(success(KEY_A));
        router.drain();

        assertThat(shown).isEmpty();
        assertThat(router.droppedCount()).isEqualTo(1);
    }

    @Test
    void failingCallback_doesNotBlockOtherCursors() {
        List<LoadResult> other = new ArrayList<>();
        ConsumerCursor broken = new ConsumerCursor("broken", r -> { throw new IllegalStateException("boom"); });
        router = new ResultRouter();
        router.register(broken).expect(KEY_A);
        router.register(new ConsumerCursor("other", other::add)).expect(KEY_A);

        router.publish(success(KEY_A));
        router.drain();

        assertThat(other).hasSize(1);
    }

    @Test
    void deliveryExecutor_coalescesDrains() {
        List<Runnable> scheduled = new ArrayList<>();
        Executor manual = scheduled::add;
        router = new ResultRouter(manual);
        router.register(viewer).expect(KEY_A);

        router.publish(success(KEY_A));
        router.publish(LoadResult.failure(KEY_A, ErrorKind.MEMBER_EMPTY, "Image file empty"));

        assertThat(scheduled).hasSize(1);
        assertThat(router.pendingCount()).isEqualTo(2);
        scheduled.get(0).run();
        assertThat(shown).hasSize(2);
        assertThat(shown.get(1).statusText()).contains("Image file empty");
        assertThat(router.pendingCount()).isZero();
    }
}
