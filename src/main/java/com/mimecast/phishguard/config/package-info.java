/**
 * Configuration files and their accessors.
 *
 * <p>The default directory is cfg/ but can be overridden with the --config cli parameter.
 * <br>Engines built without a directory use the built in defaults only.
 * <br>Both files are JSON5 and every key falls back to a built in default:
 * <ul>
 *     <li>`signals.json5` Keyword, URL, sender, brand and colour tables.</li>
 *     <li>`services.json5` Rspamd, Tesseract, vision, fetch and threading options.</li>
 * </ul>
 *
 * @see com.mimecast.phishguard.main.Engines#load(java.nio.file.Path)
 */
package com.mimecast.phishguard.config;
