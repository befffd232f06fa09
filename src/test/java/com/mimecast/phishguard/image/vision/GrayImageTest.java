package com.mimecast.phishguard.image.vision;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GrayImageTest {

    @Test
    void testSetClamps() {
        GrayImage image = new GrayImage(2, 2);
        image.set(0, 0, 400);
        image.set(1, 0, -3);

        assertEquals(255, image.get(0, 0));
        assertEquals(0, image.get(1, 0));
        assertTrue(image.isSet(0, 0));
        assertFalse(image.isSet(1, 0));
    }

    @Test
    void testCrop() {
        GrayImage image = new GrayImage(4, 4);
        image.set(2, 2, 9);

        GrayImage crop = image.crop(1, 1, 2, 2);

        assertEquals(2, crop.getWidth());
        assertEquals(2, crop.getHeight());
        assertEquals(9, crop.get(1, 1));
    }

    @Test
    void testCropIsClipped() {
        GrayImage image = new GrayImage(4, 4);

        GrayImage crop = image.crop(2, -1, 10, 2);

        assertEquals(2, crop.getWidth());
        assertEquals(1, crop.getHeight());
        assertEquals(0, image.crop(5, 5, 2, 2).size());
    }

    @Test
    void testCountBetweenExclusive() {
        GrayImage image = new GrayImage(3, 1);
        image.set(0, 0, 100);
        image.set(1, 0, 150);
        image.set(2, 0, 200);

        assertEquals(1, image.countBetween(100, 200));
    }

    @Test
    void testContourBasics() {
        Contour contour = new Contour(new int[]{0, 4, 4, 0}, new int[]{0, 0, 3, 3});

        assertEquals(12, contour.area());
        assertEquals(14, contour.perimeter(), 1e-9);
        assertEquals(5, contour.bounds().getWidth());
        assertEquals(4, contour.bounds().getHeight());
        assertEquals(1.25, contour.bounds().getAspectRatio(), 1e-9);
        assertThrows(IllegalArgumentException.class, () -> new Contour(new int[]{1}, new int[]{}));
    }
}
