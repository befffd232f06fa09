/**
 * Optical character recognition backends.
 *
 * <p>Tesseract runs through Tess4J and needs the native library plus tessdata.
 */
package com.mimecast.phishguard.image.ocr;
