package io.github.manjago.gbacore.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MemoryRegionTest {

    private MemoryRegion region;

    @BeforeEach
    void setUp() {
        region = new MemoryRegion("test", 0x0200_0000, 0x100);
    }

    @Nested
    @DisplayName("Endianness")
    class Endianness {

        @Test
        @DisplayName("32-bit write is stored little-endian")
        void wordIsLittleEndian() {
            region.write32(0x10, 0x1122_3344);

            assertEquals(0x44, region.read8(0x10));
            assertEquals(0x33, region.read8(0x11));
            assertEquals(0x22, region.read8(0x12));
            assertEquals(0x11, region.read8(0x13));
            assertEquals(0x3344, region.read16(0x10));
            assertEquals(0x1122, region.read16(0x12));
        }

        @Test
        @DisplayName("Unaligned accesses use the aligned address")
        void unalignedAccessesAlignDown() {
            region.write32(0x22, 0xCAFE_BABE);

            assertEquals(0xCAFE_BABE, region.read32(0x20));
            assertEquals(0xBABE, region.read16(0x21));
        }
    }

    @Nested
    @DisplayName("Wrapping")
    class Wrapping {

        @Test
        @DisplayName("Offsets past the capacity wrap around")
        void offsetsWrap() {
            region.write8(0x105, 0x5A);

            assertEquals(0x5A, region.read8(0x05));
        }

        @Test
        @DisplayName("offsetOf maps mirrored CPU addresses into the region")
        void offsetOfMirrors() {
            assertEquals(0x04, region.offsetOf(0x0200_0004));
            assertEquals(0x04, region.offsetOf(0x0200_0104));
            assertEquals(0x04, region.offsetOf(0x02FF_FF04));
        }
    }

    @Test
    @DisplayName("load copies the image and clear zeroes it again")
    void loadAndClear() {
        region.load(new byte[] {1, 2, 3, 4});
        assertEquals(0x0403_0201, region.read32(0));

        region.clear();
        assertEquals(0, region.read32(0));
    }

    @Test
    @DisplayName("toString names the region and its range")
    void toStringNamesRegion() {
        String text = region.toString();

        assertTrue(text.contains("test"), text);
        assertTrue(text.toUpperCase().contains("2000000"), text);
    }
}
