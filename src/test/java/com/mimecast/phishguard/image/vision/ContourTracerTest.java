package com.mimecast.phishguard.image.vision;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContourTracerTest {

    private static GrayImage binary(int width, int height) {
        return new GrayImage(width, height);
    }

    private static void fill(GrayImage image, int x, int y, int width, int height) {
        for (int j = y; j < y + height; j++) {
            for (int i = x; i < x + width; i++) {
                image.set(i, j, 255);
            }
        }
    }

    @Test
    void testFilledSquare() {
        GrayImage image = binary(30, 30);
        fill(image, 5, 5, 10, 10);

        List<Contour> contours = ContourTracer.traceExternal(image);

        assertEquals(1, contours.size());
        Contour contour = contours.get(0);
        assertEquals(36, contour.size());
        assertEquals(81, contour.area());
        assertEquals(36, contour.perimeter(), 1e-9);
        assertEquals(5, contour.bounds().getX());
        assertEquals(5, contour.bounds().getY());
        assertEquals(10, contour.bounds().getWidth());
        assertEquals(10, contour.bounds().getHeight());
    }

    @Test
    void testSeparateShapes() {
        GrayImage image = binary(40, 20);
        fill(image, 2, 2, 5, 5);
        fill(image, 20, 10, 8, 4);

        List<Contour> contours = ContourTracer.traceExternal(image);

        assertEquals(2, contours.size());
        assertEquals(2, contours.get(0).bounds().getX());
        assertEquals(20, contours.get(1).bounds().getX());
    }

    @Test
    void testShapeInsideHoleIsSkipped() {
        GrayImage image = binary(60, 60);
        fill(image, 10, 10, 40, 2);
        fill(image, 10, 48, 40, 2);
        fill(image, 10, 10, 2, 40);
        fill(image, 48, 10, 2, 40);
        fill(image, 28, 28, 4, 4);

        List<Contour> contours = ContourTracer.traceExternal(image);

        assertEquals(1, contours.size());
        assertEquals(40, contours.get(0).bounds().getWidth());
    }

    @Test
    void testShapeTouchingBorder() {
        GrayImage image = binary(10, 10);
        fill(image, 0, 0, 3, 3);

        List<Contour> contours = ContourTracer.traceExternal(image);

        assertEquals(1, contours.size());
        assertEquals(4, contours.get(0).area());
    }

    @Test
    void testSinglePixel() {
        GrayImage image = binary(5, 5);
        image.set(2, 2, 255);

        List<Contour> contours = ContourTracer.traceExternal(image);

        assertEquals(1, contours.size());
        assertEquals(1, contours.get(0).size());
        assertEquals(0, contours.get(0).area());
    }

    @Test
    void testEmptyImage() {
        assertTrue(ContourTracer.traceExternal(binary(0, 0)).isEmpty());
        assertTrue(ContourTracer.traceExternal(binary(8, 8)).isEmpty());
    }
}
