/**
 * Splitting of multipart bodies into raw sub-parts.
 */
package com.mimecast.mimetree.mime.multipart;
