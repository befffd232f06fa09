/**
 * Email and URL entry points built on the text and sender engines.
 */
package com.mimecast.phishguard.email;
