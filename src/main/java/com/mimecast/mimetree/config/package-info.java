/**
 * Handles the configuration of the parser.
 *
 * <p>Provides the configuration foundation and utilities.
 * <br>{@link com.mimecast.mimetree.config.BasicConfig} wraps a map with typed accessors.
 * <br>{@link com.mimecast.mimetree.config.ConfigFoundation} loads that map from a JSON5 file using Gson.
 * <br>{@link com.mimecast.mimetree.config.ParserConfig} names the parser settings.
 *
 * <p><b>Example:</b>
 * <pre>
 * {
 *   maxDepth: 16,
 *   repairContentTypeParameters: true,
 *   charsetAliases: {
 *     "ks_c_5601-1987": "EUC-KR"
 *   }
 * }
 * </pre>
 */
package com.mimecast.mimetree.config;
