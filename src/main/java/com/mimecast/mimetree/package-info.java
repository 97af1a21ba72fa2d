/**
 * The main package for MimeTree, a MIME document to part tree parser.
 *
 * <p>MimeTree reads an email style document, header block plus optionally nested multipart body,
 * <br>and hands back a tree of parts with resolved content type, disposition, file name and decoded content.
 * <br>It is meant as a library for email processing tools; see {@link com.mimecast.mimetree.mime.MimeParser}.
 *
 * <p>This project can be compiled into a runnable JAR.
 *
 * <h2>CLI usage:</h2>
 * <pre>
 *      $ java -jar mimetree.jar --help
 *      MIME part tree parser
 *
 *      usage:   [-c &lt;arg&gt;] [-f &lt;arg&gt;] [-h] [-j] [-x]
 *      -c,--conf &lt;arg&gt;   Path to parser configuration JSON5 file
 *      -f,--file &lt;arg&gt;   MIME file to parse
 *      -h,--help         Show usage help
 *      -j,--json         Print tree as JSON
 *      -x,--content      Include decoded text content
 * </pre>
 */
package com.mimecast.mimetree;
