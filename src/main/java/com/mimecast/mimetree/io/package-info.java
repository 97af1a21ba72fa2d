/**
 * Line oriented byte stream reading.
 */
package com.mimecast.mimetree.io;
