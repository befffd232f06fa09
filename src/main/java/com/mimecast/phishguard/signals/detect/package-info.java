/**
 * Primitive detectors shared by the engines.
 */
package com.mimecast.phishguard.signals.detect;
