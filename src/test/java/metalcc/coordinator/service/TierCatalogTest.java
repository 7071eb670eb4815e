package metalcc.coordinator.service;

import metalcc.coordinator.error.ConflictException;
import metalcc.coordinator.error.InvalidTierException;
import metalcc.coordinator.error.NotFoundException;
import metalcc.coordinator.model.ResourceShape;
import metalcc.coordinator.model.Tier;
import metalcc.coordinator.store.UnitOfWork;
import metalcc.coordinator.testing.TestContext;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class TierCatalogTest {

    private static final ResourceShape SHAPE = new ResourceShape(2, 4096, 40, 0);

    private TestContext ctx;
    private TierCatalog catalog;

    @BeforeEach
    void setUp() {
        ctx = TestContext.create();
        catalog = ctx.deps.tierCatalog();
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void exactShapeMatch() {
        Tier tier = catalog.create("medium", SHAPE, 3);

        try (UnitOfWork tx = ctx.deps.database().begin()) {
            assertEquals(tier, catalog.matchTier(tx, SHAPE));
            assertThrows(InvalidTierException.class,
                    () -> catalog.matchTier(tx, new ResourceShape(2, 4096, 41, 0)));
        }
    }

    @Test
    void duplicateShapeOrNameConflicts() {
        catalog.create("medium", SHAPE, 3);

        assertThrows(ConflictException.class, () -> catalog.create("other", SHAPE, 5));
        assertThrows(ConflictException.class,
                () -> catalog.create("medium", new ResourceShape(1, 1024, 10, 0), 1));
        assertEquals(1, catalog.list().size());
    }

    @Test
    void invalidTierDefinitions() {
        assertThrows(IllegalArgumentException.class, () -> catalog.create(" ", SHAPE, 1));
        assertThrows(IllegalArgumentException.class,
                () -> catalog.create("zero", new ResourceShape(0, 1024, 10, 0), 1));
        assertThrows(IllegalArgumentException.class, () -> catalog.create("neg", SHAPE, -1));
    }

    @Test
    void deleteTier() {
        Tier tier = catalog.create("medium", SHAPE, 3);
        catalog.delete(tier.id());

        assertTrue(catalog.list().isEmpty());
        assertThrows(NotFoundException.class, () -> catalog.delete(tier.id()));
    }
}
