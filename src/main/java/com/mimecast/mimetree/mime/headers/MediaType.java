package com.mimecast.mimetree.mime.headers;

import com.mimecast.mimetree.mime.exceptions.MediaTypeParseException;
import org.apache.commons.lang3.StringUtils;

import javax.mail.internet.ContentDisposition;
import javax.mail.internet.ContentType;
import javax.mail.internet.ParameterList;
import javax.mail.internet.ParseException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed structured header value.
 *
 * <p>Splits a Content-Type or Content-Disposition value into its canonical lower-case value
 * <br>and a map of parameters keyed by lower-case name.
 * <p>The RFC 2045 grammar itself is delegated to javax.mail.
 */
public class MediaType {

    /**
     * Canonical value without parameters.
     */
    private final String value;

    /**
     * Parameters by lower-case name.
     */
    private final Map<String, String> parameters;

    /**
     * Constructs a new MediaType instance.
     *
     * @param value      Canonical value.
     * @param parameters Parameters map.
     */
    private MediaType(String value, Map<String, String> parameters) {
        this.value = value;
        this.parameters = Collections.unmodifiableMap(parameters);
    }

    /**
     * Parses a Content-Type value.
     *
     * @param header Header value.
     * @return MediaType instance.
     * @throws MediaTypeParseException Empty or malformed value.
     */
    public static MediaType parse(String header) throws MediaTypeParseException {
        if (StringUtils.isBlank(header)) {
            throw new MediaTypeParseException(StringUtils.defaultString(header), "No media type");
        }

        try {
            ContentType contentType = new ContentType(header);
            if (StringUtils.isBlank(contentType.getPrimaryType()) || StringUtils.isBlank(contentType.getSubType())) {
                throw new MediaTypeParseException(header, "Incomplete media type");
            }

            return new MediaType(contentType.getBaseType().toLowerCase(Locale.ROOT), toMap(contentType.getParameterList()));

        } catch (ParseException e) {
            throw new MediaTypeParseException(header, e);
        }
    }

    /**
     * Parses a Content-Disposition value.
     *
     * @param header Header value.
     * @return MediaType instance.
     * @throws MediaTypeParseException Empty or malformed value.
     */
    public static MediaType parseDisposition(String header) throws MediaTypeParseException {
        if (StringUtils.isBlank(header)) {
            throw new MediaTypeParseException(StringUtils.defaultString(header), "No disposition");
        }

        try {
            ContentDisposition disposition = new ContentDisposition(header);
            if (StringUtils.isBlank(disposition.getDisposition())) {
                throw new MediaTypeParseException(header, "No disposition");
            }

            return new MediaType(disposition.getDisposition().toLowerCase(Locale.ROOT), toMap(disposition.getParameterList()));

        } catch (ParseException e) {
            throw new MediaTypeParseException(header, e);
        }
    }

    /**
     * Copies a javax.mail parameter list.
     *
     * @param list ParameterList instance, may be null.
     * @return Map of lower-case name to value.
     */
    private static Map<String, String> toMap(ParameterList list) {
        Map<String, String> map = new LinkedHashMap<>();
        if (list != null) {
            Enumeration<String> names = list.getNames();
            while (names.hasMoreElements()) {
                String name = names.nextElement();
                map.put(name.toLowerCase(Locale.ROOT), list.get(name));
            }
        }
        return map;
    }

    /**
     * Gets canonical value.
     *
     * @return String such as {@code text/plain} or {@code attachment}.
     */
    public String getValue() {
        return value;
    }

    /**
     * Is multipart media type.
     *
     * @return Boolean.
     */
    public boolean isMultipart() {
        return value.startsWith("multipart/");
    }

    /**
     * Gets parameter.
     *
     * @param name Parameter name, case-insensitive.
     * @return Parameter value or empty string if absent.
     */
    public String getParameter(String name) {
        return StringUtils.defaultString(parameters.get(name.toLowerCase(Locale.ROOT)));
    }

    /**
     * Gets parameters.
     *
     * @return Unmodifiable map of lower-case name to value.
     */
    public Map<String, String> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return value + parameters;
    }
}
