package com.ora.personalization.taxonomy;

import com.ora.personalization.classification.ClassificationModels.Classification;
import com.ora.personalization.classification.ClassificationModels.ClassificationSignal;
import com.ora.personalization.classification.ClassificationModels.PostInterestClassification;
import com.ora.personalization.error.InvalidParentException;
import com.ora.personalization.error.NotFoundException;
import com.ora.personalization.error.TaxonomyValidationException;
import com.ora.personalization.repository.ClassificationJdbcRepository;
import com.ora.personalization.taxonomy.TaxonomyModels.*;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class TaxonomyServiceTest {
    @Autowired
    private TaxonomyService taxonomyService;
    @Autowired
    private ClassificationJdbcRepository classifications;

    @Test
    void childInheritsLevelAndPathFromParent() {
        String u = unique();
        Interest root = create("tx-" + u, null, "Root " + u);
        Interest child = create("tx-" + u + "-kid", root.id(), "Street Style");

        assertEquals(0, root.level());
        assertTrue(root.isRoot());
        assertEquals(1, child.level());
        assertEquals(root.id(), child.parentId());
        assertEquals(List.of("root-" + u, "street-style"), child.path());
        assertEquals(child.level(), child.path().size() - 1);
    }

    @Test
    void creatingInterestAsItsOwnParentIsRejected() {
        String u = unique();
        Interest existing = create("tx-" + u, null, "Self " + u);

        InvalidParentException ex = assertThrows(InvalidParentException.class,
                () -> create(existing.id(), existing.id(), "Self Again " + u));
        assertEquals(InvalidParentException.SELF_PARENT, ex.code());
        assertEquals("parentId", ex.field());

        InvalidParentException moved = assertThrows(InvalidParentException.class,
                () -> taxonomyService.update(existing.id(), InterestUpdate.moveUnder(existing.id())));
        assertEquals(InvalidParentException.SELF_PARENT, moved.code());
    }

    @Test
    void movingNodeUnderItsOwnDescendantIsRejected() {
        String u = unique();
        Interest a = create("tx-" + u + "-a", null, "Cycle A " + u);
        Interest b = create("tx-" + u + "-b", a.id(), "Cycle B");
        Interest c = create("tx-" + u + "-c", b.id(), "Cycle C");

        InvalidParentException ex = assertThrows(InvalidParentException.class,
                () -> taxonomyService.update(a.id(), InterestUpdate.moveUnder(c.id())));
        assertEquals(InvalidParentException.CYCLE, ex.code());
        assertNull(taxonomyService.getInterest(a.id()).parentId());
    }

    @Test
    void reparentRewritesWholeSubtree() {
        String u = unique();
        Interest oldRoot = create("tx-" + u + "-old", null, "Old " + u);
        Interest newRoot = create("tx-" + u + "-new", null, "New " + u);
        Interest mid = create("tx-" + u + "-mid", oldRoot.id(), "Mid");
        Interest leaf = create("tx-" + u + "-leaf", mid.id(), "Leaf");

        Interest moved = taxonomyService.update(mid.id(), InterestUpdate.moveUnder(newRoot.id()));

        assertEquals(newRoot.id(), moved.parentId());
        assertEquals(List.of("new-" + u, "mid"), moved.path());
        Interest reloadedLeaf = taxonomyService.getInterest(leaf.id());
        assertEquals(2, reloadedLeaf.level());
        assertEquals(List.of("new-" + u, "mid", "leaf"), reloadedLeaf.path());

        Interest detached = taxonomyService.update(mid.id(), InterestUpdate.moveToRootLevel());
        assertEquals(0, detached.level());
        assertNull(detached.parentId());
        assertEquals(List.of("mid", "leaf"), taxonomyService.getInterest(leaf.id()).path());
    }

    @Test
    void renameRewritesDescendantPaths() {
        String u = unique();
        Interest root = create("tx-" + u, null, "Before " + u);
        Interest child = create("tx-" + u + "-kid", root.id(), "Kid");

        InterestUpdate rename = new InterestUpdate("After " + u, "After", null, null, null, null, null, null, null);
        taxonomyService.update(root.id(), rename);

        assertEquals(List.of("after-" + u, "kid"), taxonomyService.getInterest(child.id()).path());
        assertEquals("After", taxonomyService.getInterest(root.id()).displayName());
    }

    @Test
    void siblingNamesMustBeUnique() {
        String u = unique();
        Interest parentA = create("tx-" + u + "-pa", null, "Parent A " + u);
        Interest parentB = create("tx-" + u + "-pb", null, "Parent B " + u);
        create("tx-" + u + "-x1", parentA.id(), "Vintage");

        TaxonomyValidationException ex = assertThrows(TaxonomyValidationException.class,
                () -> create("tx-" + u + "-x2", parentA.id(), "  VINTAGE "));
        assertEquals("DUPLICATE_NAME", ex.code());
        assertEquals("name", ex.field());

        assertEquals("vintage", create("tx-" + u + "-x3", parentB.id(), "Vintage").name());
    }

    @Test
    void missingParentAndBlankNameAreRejected() {
        String u = unique();
        InvalidParentException missing = assertThrows(InvalidParentException.class,
                () -> create("tx-" + u, "no-such-parent-" + u, "Orphan"));
        assertEquals(InvalidParentException.MISSING_PARENT, missing.code());

        TaxonomyValidationException blank = assertThrows(TaxonomyValidationException.class,
                () -> create("tx-" + u + "-blank", null, "   "));
        assertEquals("REQUIRED", blank.code());
    }

    @Test
    void depthIsBoundedByMaxDepth() {
        String u = unique();
        Interest parent = create("tx-" + u + "-0", null, "Deep " + u);
        for (int level = 1; level < 8; level++) {
            parent = create("tx-" + u + "-" + level, parent.id(), "Level " + level);
        }
        assertEquals(7, parent.level());

        String lastParent = parent.id();
        InvalidParentException ex = assertThrows(InvalidParentException.class,
                () -> create("tx-" + u + "-8", lastParent, "Too Deep"));
        assertEquals(InvalidParentException.DEPTH, ex.code());
    }

    @Test
    void deactivatedInterestsLeaveTheTreeButRemainReadable() {
        String u = unique();
        Interest root = create("tx-" + u, null, "Tree " + u);
        Interest child = create("tx-" + u + "-kid", root.id(), "Visible");
        Interest hidden = create("tx-" + u + "-hidden", root.id(), "Hidden");

        taxonomyService.deactivate(hidden.id());

        InterestTreeNode node = taxonomyService.getTree(TreeScope.FULL).stream()
                .filter(n -> n.interest().id().equals(root.id()))
                .findFirst().orElseThrow();
        assertEquals(List.of(child.id()), node.children().stream().map(n -> n.interest().id()).toList());
        assertFalse(taxonomyService.getInterest(hidden.id()).active());

        assertTrue(taxonomyService.getTree(TreeScope.ROOTS).stream()
                .allMatch(n -> n.children().isEmpty() && n.interest().isRoot()));

        InvalidParentException ex = assertThrows(InvalidParentException.class,
                () -> create("tx-" + u + "-under-hidden", hidden.id(), "Nope"));
        assertEquals(InvalidParentException.INACTIVE_PARENT, ex.code());
    }

    @Test
    void recalculateStatsIsIdempotent() {
        String u = unique();
        Interest interest = create("tx-" + u, null, "Stats " + u);
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        for (String postId : List.of("tx-post-" + u + "-1", "tx-post-" + u + "-2")) {
            classifications.replace(new PostInterestClassification(postId,
                    List.of(new Classification(interest.id(), interest.name(), 0, 0.9, List.of(ClassificationSignal.TAG_MATCH))),
                    now, "1.0"));
        }

        StatsRecount first = taxonomyService.recalculateStats(interest.id());
        assertEquals(0, first.oldCount());
        assertEquals(2, first.newCount());
        assertEquals(2.0, first.weeklyGrowth(), 1e-9);

        StatsRecount second = taxonomyService.recalculateStats(interest.id());
        assertEquals(2, second.oldCount());
        assertEquals(2, second.newCount());
        assertEquals(2, taxonomyService.getInterest(interest.id()).postCount());
    }

    @Test
    void searchPathAndRelatedInterests() {
        String u = unique();
        Interest root = create("tx-" + u, null, "Garden " + u);
        Interest roses = taxonomyService.createInterest(new CreateInterestRequest("tx-" + u + "-roses", root.id(), "Roses",
                "Roses", null, List.of("qwroses" + u), List.of(), List.of()));
        Interest tulips = create("tx-" + u + "-tulips", root.id(), "Tulips");
        Interest other = create("tx-" + u + "-other", null, "Elsewhere " + u);
        taxonomyService.update(roses.id(), new InterestUpdate(null, null, null, null, null, List.of(other.id()), null, null, null));

        assertEquals(List.of(roses.id()), taxonomyService.searchInterests("QWROSES" + u, 10).stream().map(Interest::id).toList());
        assertEquals(List.of(root.id(), roses.id()), taxonomyService.getInterestPath(roses.id()).stream().map(Interest::id).toList());
        assertEquals(List.of(other.id(), tulips.id()), taxonomyService.getRelatedInterests(roses.id(), 5).stream().map(Interest::id).toList());
        assertEquals(List.of(roses.id(), tulips.id()), taxonomyService.getChildren(root.id()).stream().map(Interest::id).toList());
    }

    @Test
    void overlongFieldsAreRejectedBeforeStorage() {
        String u = unique();
        TaxonomyValidationException name = assertThrows(TaxonomyValidationException.class,
                () -> create("tx-" + u, null, "n".repeat(129)));
        assertEquals("TOO_LONG", name.code());
        assertEquals("name", name.field());

        TaxonomyValidationException id = assertThrows(TaxonomyValidationException.class,
                () -> create("x".repeat(65), null, "Long " + u));
        assertEquals("id", id.field());

        TaxonomyValidationException display = assertThrows(TaxonomyValidationException.class,
                () -> taxonomyService.createInterest(new CreateInterestRequest("tx-" + u, null, "Display " + u, "d".repeat(257),
                        null, List.of(), List.of(), List.of())));
        assertEquals("displayName", display.field());

        Interest ok = create("tx-" + u, null, "Fits " + u);
        TaxonomyValidationException renamed = assertThrows(TaxonomyValidationException.class,
                () -> taxonomyService.update(ok.id(), new InterestUpdate("r".repeat(200), null, null, null, null, null, null, null, null)));
        assertEquals("name", renamed.field());
        assertEquals("fits-" + u, taxonomyService.getInterest(ok.id()).name());
    }

    @Test
    void concurrentCreatesOfOneNameLetExactlyOneThrough() throws Exception {
        String u = unique();
        Interest parent = create("tx-" + u, null, "Race " + u);
        Queue<Interest> created = new ConcurrentLinkedQueue<>();
        Queue<String> rejected = new ConcurrentLinkedQueue<>();
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String id = "tx-" + u + "-dup-" + i;
            tasks.add(() -> {
                try {
                    created.add(create(id, parent.id(), "Same Name"));
                } catch (TaxonomyValidationException e) {
                    rejected.add(e.code());
                }
            });
        }
        runConcurrently(tasks);

        assertEquals(1, created.size());
        assertEquals(Collections.nCopies(5, "DUPLICATE_NAME"), List.copyOf(rejected));
        assertEquals(1, taxonomyService.getChildren(parent.id()).size());
    }

    @Test
    void moveToRootAndRootCreateCannotBothTakeOneName() throws Exception {
        String u = unique();
        Interest parent = create("tx-" + u, null, "Holder " + u);
        Interest nested = create("tx-" + u + "-nested", parent.id(), "Orbit " + u);
        Queue<String> outcomes = new ConcurrentLinkedQueue<>();

        runConcurrently(List.of(
                () -> {
                    try {
                        taxonomyService.update(nested.id(), InterestUpdate.moveToRootLevel());
                        outcomes.add("moved");
                    } catch (TaxonomyValidationException e) {
                        outcomes.add(e.code());
                    }
                },
                () -> {
                    try {
                        create("tx-" + u + "-root", null, "Orbit " + u);
                        outcomes.add("created");
                    } catch (TaxonomyValidationException e) {
                        outcomes.add(e.code());
                    }
                }));

        assertTrue(outcomes.contains("DUPLICATE_NAME"), outcomes.toString());
        long rootsNamedOrbit = taxonomyService.getTree(TreeScope.ROOTS).stream()
                .filter(n -> n.interest().name().equals("orbit-" + u))
                .count();
        assertEquals(1, rootsNamedOrbit);
    }

    @Test
    void concurrentStatsRecountsOfOneNodeAreSerialized() throws Exception {
        String u = unique();
        Interest interest = create("tx-" + u, null, "Busy " + u);
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        for (int i = 0; i < 3; i++) {
            classifications.replace(new PostInterestClassification("tx-post-" + u + "-" + i,
                    List.of(new Classification(interest.id(), interest.name(), 0, 0.9, List.of(ClassificationSignal.TAG_MATCH))),
                    now, "1.0"));
        }
        Queue<StatsRecount> results = new ConcurrentLinkedQueue<>();
        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            tasks.add(() -> results.add(taxonomyService.recalculateStats(interest.id())));
        }
        runConcurrently(tasks);

        assertEquals(8, results.size());
        assertTrue(results.stream().allMatch(r -> r.newCount() == 3));
        assertEquals(1, results.stream().filter(r -> r.oldCount() == 0).count());
        assertEquals(3, taxonomyService.getInterest(interest.id()).postCount());
    }

    @Test
    void updatingUnknownInterestIsNotFound() {
        assertThrows(NotFoundException.class,
                () -> taxonomyService.update("missing-" + unique(), new InterestUpdate(null, "x", null, null, null, null, null, null, null)));
    }

    private Interest create(String id, String parentId, String name) {
        return taxonomyService.createInterest(new CreateInterestRequest(id, parentId, name, null, null, List.of(), List.of(), List.of()));
    }

    private static void runConcurrently(List<Runnable> tasks) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (Runnable task : tasks) {
                futures.add(pool.submit(() -> {
                    start.await();
                    task.run();
                    return null;
                }));
            }
            start.countDown();
            for (Future<Object> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static String unique() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
