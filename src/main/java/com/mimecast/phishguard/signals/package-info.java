/**
 * Signal results and their aggregation.
 *
 * <p>Every engine reports a {@link com.mimecast.phishguard.signals.SignalResult} carrying a risk score,
 * <br>a set of indicator tags and a confidence in [0, 1].
 * <br>Risk levels are derived from the score:
 * <ul>
 *     <li><b>low</b> - below 30.</li>
 *     <li><b>medium</b> - 30 to 59.</li>
 *     <li><b>high</b> - 60 to 79.</li>
 *     <li><b>critical</b> - 80 and above.</li>
 * </ul>
 *
 * <p>The {@link com.mimecast.phishguard.signals.Aggregator} sums scores, unions indicators and
 * <br>averages the confidence of every result carrying a valid score.
 *
 * @see com.mimecast.phishguard.signals.Aggregator
 */
package com.mimecast.phishguard.signals;
