/**
 * Remote image download.
 */
package com.mimecast.phishguard.http;
