package metalcc.coordinator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResourceShapeTest {

    private static final ResourceShape REQUEST = new ResourceShape(2, 2048, 20, 1);

    @Test
    void hostsWhenStrictlyLarger() {
        assertTrue(new ResourceShape(3, 2049, 21, 1).canHost(REQUEST));
    }

    @Test
    void equalCpuMemoryOrDiskIsNotEnough() {
        assertFalse(new ResourceShape(2, 4096, 40, 1).canHost(REQUEST));
        assertFalse(new ResourceShape(4, 2048, 40, 1).canHost(REQUEST));
        assertFalse(new ResourceShape(4, 4096, 20, 1).canHost(REQUEST));
    }

    @Test
    void gpusMayMatchExactly() {
        assertTrue(new ResourceShape(4, 4096, 40, 1).canHost(REQUEST));
        assertFalse(new ResourceShape(4, 4096, 40, 0).canHost(REQUEST));
    }

    @Test
    void arithmetic() {
        ResourceShape a = new ResourceShape(4, 4096, 40, 2);
        assertEquals(new ResourceShape(2, 2048, 20, 1), a.minus(REQUEST));
        assertEquals(new ResourceShape(6, 6144, 60, 3), a.plus(REQUEST));
    }
}
