/**
 * Text phishing signals.
 *
 * <p>Keyword categories, writing style, links, sender formatting and an optional pretrained classifier
 * <br>each contribute a partial result combined by the {@link com.mimecast.phishguard.signals.Aggregator}.
 *
 * <p>Classifiers implement {@link com.mimecast.phishguard.text.TextClassifier}.
 * <br>The default one is selected in {@link com.mimecast.phishguard.main.Factories}.
 */
package com.mimecast.phishguard.text;
