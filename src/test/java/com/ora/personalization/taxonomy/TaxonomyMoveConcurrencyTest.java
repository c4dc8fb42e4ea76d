package com.ora.personalization.taxonomy;

import com.ora.personalization.repository.InterestJdbcRepository;
import com.ora.personalization.taxonomy.TaxonomyModels.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doAnswer;

/**
 * Holds a reparent between reading the tree and writing it, then lets other mutations race it.
 */
@SpringBootTest
class TaxonomyMoveConcurrencyTest {
    @Autowired
    private TaxonomyService taxonomyService;
    @SpyBean
    private InterestJdbcRepository repository;

    private final ExecutorService pool = Executors.newFixedThreadPool(2);
    private final CountDownLatch treeRead = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        pool.shutdownNow();
    }

    @Test
    void createUnderMovingParentWaitsAndInheritsTheNewPath() throws Exception {
        String u = unique();
        Interest a = create("mv-" + u + "-a", null, "Alpha " + u);
        Interest b = create("mv-" + u + "-b", null, "Beta " + u);
        Interest x = create("mv-" + u + "-x", a.id(), "Moving");
        pauseNextTreeRead();

        Future<Interest> move = pool.submit(() -> taxonomyService.update(x.id(), InterestUpdate.moveUnder(b.id())));
        assertTrue(treeRead.await(10, TimeUnit.SECONDS));
        Future<Interest> child = pool.submit(() -> create("mv-" + u + "-c", x.id(), "Child"));
        assertThrows(TimeoutException.class, () -> child.get(300, TimeUnit.MILLISECONDS));

        release.countDown();
        Interest moved = move.get(10, TimeUnit.SECONDS);
        Interest created = child.get(10, TimeUnit.SECONDS);

        assertEquals(List.of("beta-" + u, "moving"), moved.path());
        assertEquals(List.of("beta-" + u, "moving", "child"), created.path());
        assertEquals(2, created.level());
        assertEquals(created.path(), taxonomyService.getInterest(created.id()).path());
    }

    @Test
    void deactivateOfMovingNodeWaitsForTheMove() throws Exception {
        String u = unique();
        Interest a = create("mv-" + u + "-a", null, "Alpha " + u);
        Interest b = create("mv-" + u + "-b", null, "Beta " + u);
        Interest x = create("mv-" + u + "-x", a.id(), "Moving");
        pauseNextTreeRead();

        Future<Interest> move = pool.submit(() -> taxonomyService.update(x.id(), InterestUpdate.moveUnder(b.id())));
        assertTrue(treeRead.await(10, TimeUnit.SECONDS));
        Future<?> deactivate = pool.submit(() -> taxonomyService.deactivate(x.id()));
        assertThrows(TimeoutException.class, () -> deactivate.get(300, TimeUnit.MILLISECONDS));

        release.countDown();
        move.get(10, TimeUnit.SECONDS);
        deactivate.get(10, TimeUnit.SECONDS);

        Interest stored = taxonomyService.getInterest(x.id());
        assertFalse(stored.active());
        assertEquals(b.id(), stored.parentId());
    }

    @Test
    void descendantDetailEditsSurviveAConcurrentMove() throws Exception {
        String u = unique();
        Interest a = create("mv-" + u + "-a", null, "Alpha " + u);
        Interest b = create("mv-" + u + "-b", null, "Beta " + u);
        Interest x = create("mv-" + u + "-x", a.id(), "Moving");
        Interest leaf = create("mv-" + u + "-leaf", x.id(), "Leaf");
        pauseNextTreeRead();

        Future<Interest> move = pool.submit(() -> taxonomyService.update(x.id(), InterestUpdate.moveUnder(b.id())));
        assertTrue(treeRead.await(10, TimeUnit.SECONDS));
        taxonomyService.update(leaf.id(), new InterestUpdate(null, "Edited Leaf", "edited while moving",
                List.of("foliage"), null, null, null, null, null));

        release.countDown();
        move.get(10, TimeUnit.SECONDS);

        Interest stored = taxonomyService.getInterest(leaf.id());
        assertEquals("Edited Leaf", stored.displayName());
        assertEquals("edited while moving", stored.description());
        assertEquals(List.of("foliage"), stored.keywords());
        assertEquals(List.of("beta-" + u, "moving", "leaf"), stored.path());
    }

    /** The next full-tree read returns its rows, then blocks until {@link #release} opens. */
    private void pauseNextTreeRead() {
        AtomicBoolean armed = new AtomicBoolean(true);
        doAnswer(invocation -> {
            Object rows = invocation.callRealMethod();
            if (armed.compareAndSet(true, false)) {
                treeRead.countDown();
                assertTrue(release.await(10, TimeUnit.SECONDS));
            }
            return rows;
        }).when(repository).findAll();
    }

    private Interest create(String id, String parentId, String name) {
        return taxonomyService.createInterest(new CreateInterestRequest(id, parentId, name, null, null, List.of(), List.of(), List.of()));
    }

    private static String unique() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
