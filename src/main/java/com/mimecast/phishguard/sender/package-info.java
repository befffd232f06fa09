/**
 * Sender identity checks.
 */
package com.mimecast.phishguard.sender;
