package metalcc.coordinator.service;

import metalcc.coordinator.error.ConflictException;
import metalcc.coordinator.error.NotFoundException;
import metalcc.coordinator.model.Account;
import metalcc.coordinator.testing.TestContext;
import org.junit.jupiter.api.*;

import static metalcc.coordinator.testing.TestContext.BIG_NODE;
import static metalcc.coordinator.testing.TestContext.SMALL;
import static metalcc.coordinator.testing.TestContext.registration;
import static org.junit.jupiter.api.Assertions.*;

class AccountServiceTest {

    private TestContext ctx;
    private AccountService accounts;

    @BeforeEach
    void setUp() {
        ctx = TestContext.create();
        accounts = ctx.deps.accountService();
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void createAndFindByToken() {
        Account account = accounts.create("acme", 50);

        assertEquals(32, account.apiToken().length());
        assertEquals(account, accounts.findByToken(account.apiToken()).orElseThrow());
        assertEquals(50, accounts.read(account.id()).credits());
        assertTrue(accounts.findByToken("nope").isEmpty());
        assertTrue(accounts.findByToken(null).isEmpty());
    }

    @Test
    void tokensAreUnique() {
        Account a = accounts.create("a", 0);
        Account b = accounts.create("b", 0);
        assertNotEquals(a.apiToken(), b.apiToken());
        assertEquals(2, accounts.list().size());
    }

    @Test
    void duplicateName() {
        accounts.create("acme", 1);
        assertThrows(ConflictException.class, () -> accounts.create("acme", 1));
    }

    @Test
    void negativeBalanceRejected() {
        assertThrows(IllegalArgumentException.class, () -> accounts.create("acme", -1));
    }

    @Test
    void addCredits() {
        Account account = accounts.create("acme", 10);
        Account updated = accounts.addCredits(account.id(), 15);

        assertEquals(25, updated.credits());
        assertEquals(25, accounts.read(account.id()).credits());
        assertThrows(IllegalArgumentException.class, () -> accounts.addCredits(account.id(), 0));
        assertThrows(NotFoundException.class, () -> accounts.addCredits("ghost", 5));
    }

    @Test
    void spendRateSumsActiveWorkloads() {
        ctx.deps.nodeRegistry().register(registration("node-1", BIG_NODE));
        ctx.deps.tierCatalog().create("small", SMALL, 2);
        Account account = accounts.create("acme", 1000);
        assertEquals(0, accounts.spendRate(account.id()));

        ctx.deps.workloadService().create(account, new WorkloadSpec("a", SMALL, null, null));
        ctx.deps.workloadService().create(account, new WorkloadSpec("b", SMALL, null, null));

        assertEquals(4, accounts.spendRate(account.id()));
    }
}
