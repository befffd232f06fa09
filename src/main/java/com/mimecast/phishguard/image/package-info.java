/**
 * Image phishing signals.
 *
 * <p>{@link com.mimecast.phishguard.image.ImageSignalEngine} loads an image from a data URI, URL or file,
 * <br>prepares OCR text and a grayscale copy once and runs every
 * <br>{@link com.mimecast.phishguard.image.ImageSubAnalysis} over them.
 *
 * <h2>Sub-analyses:</h2>
 * <ul>
 *     <li><b>ocr_text</b> - keyword categories and URLs in recognised text.</li>
 *     <li><b>visual_elements</b> - form fields, security icons and overlays.</li>
 *     <li><b>brand_impersonation</b> - brand mentions, contexts and palettes.</li>
 *     <li><b>layout_patterns</b> - centred login forms, popups, overlays and fake browser chrome.</li>
 *     <li><b>color_patterns</b> - warning palettes and high contrast.</li>
 * </ul>
 *
 * <p>Without OCR and vision the engine returns a fixed low confidence result.
 */
package com.mimecast.phishguard.image;
