package metalcc.coordinator.api.admin.v1.dto;

import metalcc.coordinator.model.ResourceShape;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CreateTierRequestTest {

    @Test
    void validTier() {
        CreateTierRequest req = new CreateTierRequest("gpu-small", 4, 8192, 80, 1, 10);
        assertDoesNotThrow(req::validate);
        assertEquals(new ResourceShape(4, 8192, 80, 1), req.shape());
    }

    @Test
    void invalidTiers() {
        assertThrows(IllegalArgumentException.class, new CreateTierRequest(null, 1, 1, 1, 0, 1)::validate);
        assertThrows(IllegalArgumentException.class, new CreateTierRequest("t", 0, 1, 1, 0, 1)::validate);
        assertThrows(IllegalArgumentException.class, new CreateTierRequest("t", 1, 1, 1, -1, 1)::validate);
        assertThrows(IllegalArgumentException.class, new CreateTierRequest("t", 1, 1, 1, 0, -1)::validate);
    }
}
