package metalcc.coordinator.scheduler;

import metalcc.coordinator.model.Account;
import metalcc.coordinator.service.WorkloadSpec;
import metalcc.coordinator.testing.TestContext;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static metalcc.coordinator.testing.TestContext.BIG_NODE;
import static metalcc.coordinator.testing.TestContext.SMALL;
import static metalcc.coordinator.testing.TestContext.registration;
import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    @Test
    void startAndStop() {
        try (TestContext ctx = TestContext.create()) {
            Scheduler scheduler = ctx.deps.scheduler();
            assertFalse(scheduler.isRunning());

            ctx.deps.startScheduler();
            assertTrue(scheduler.isRunning());

            scheduler.stop();
            assertFalse(scheduler.isRunning());
        }
    }

    @Test
    void meteringRunsPeriodically() throws Exception {
        try (TestContext ctx = TestContext.create(TestContext.baseConfig()
                .withMetering(true, Duration.ofMillis(50)))) {
            ctx.deps.nodeRegistry().register(registration("node-1", BIG_NODE));
            ctx.deps.tierCatalog().create("small", SMALL, 1);
            Account account = ctx.deps.accountService().create("acme", 100);
            ctx.deps.workloadService().create(account, new WorkloadSpec("web", SMALL, null, null));

            ctx.deps.startScheduler();

            long deadline = System.currentTimeMillis() + 5000;
            while (ctx.deps.accountService().read(account.id()).credits() == 100
                    && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(ctx.deps.accountService().read(account.id()).credits() < 100);
        }
    }
}
