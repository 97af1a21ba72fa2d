/**
 * Application wide configuration holder.
 */
package com.mimecast.mimetree.main;
