package metalcc.coordinator.placement;

import metalcc.coordinator.error.NoCapacityAvailableException;
import metalcc.coordinator.model.Node;
import metalcc.coordinator.model.NodeUsage;
import metalcc.coordinator.model.ResourceShape;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static metalcc.coordinator.placement.PlacementTestNodes.usage;
import static org.junit.jupiter.api.Assertions.*;

class PlacementSelectorTest {

    private static final ResourceShape REQUEST = new ResourceShape(1, 1024, 10, 0);

    private final PlacementSelector selector = new PlacementSelector(new RandomSelectionStrategy());

    @Test
    void returnsClaimedNode() {
        Node node = selector.place(List.of(usage("a"), usage("b")), REQUEST, c -> true);
        assertTrue(List.of("a", "b").contains(node.id()));
    }

    @Test
    void skipsNodesThatFailTheClaim() {
        List<String> tried = new ArrayList<>();
        Node node = selector.place(List.of(usage("a"), usage("b"), usage("c")), REQUEST, c -> {
            tried.add(c.node().id());
            return c.node().id().equals("c");
        });

        assertEquals("c", node.id());
        assertEquals(tried.size(), tried.stream().distinct().count(), "a failed node is never retried");
    }

    @Test
    void noCandidates() {
        assertThrows(NoCapacityAvailableException.class, () -> selector.place(List.of(), REQUEST, c -> true));
    }

    @Test
    void allClaimsFail() {
        List<NodeUsage> candidates = List.of(usage("a"), usage("b"));
        assertThrows(NoCapacityAvailableException.class, () -> selector.place(candidates, REQUEST, c -> false));
    }
}
