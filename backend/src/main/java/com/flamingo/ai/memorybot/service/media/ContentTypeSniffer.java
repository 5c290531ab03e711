package com.flamingo.ai.memorybot.service.media;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.mime.MimeTypeException;
import org.apache.tika.mime.MimeTypes;
import org.springframework.stereotype.Component;

/**
 * Detects the real content type of a payload from its leading signature bytes.
 *
 * <p>Messaging providers often mislabel attachments, for example voice notes sent as {@code
 * application/octet-stream}, so a matching signature always wins over the declared type. Type
 * names are looked up in Tika's MIME registry, which also supplies file extensions.
 */
@Component
@Slf4j
public class ContentTypeSniffer {

  public static final String FALLBACK_TYPE = "application/octet-stream";

  static final String DEFAULT_EXTENSION = ".bin";

  /** Bytes inspected when classifying a payload. */
  static final int HEADER_LENGTH = 16;

  private final MimeTypes mimeTypes;

  public ContentTypeSniffer() {
    this(MimeTypes.getDefaultMimeTypes());
  }

  ContentTypeSniffer(MimeTypes mimeTypes) {
    this.mimeTypes = mimeTypes;
  }

  /**
   * Returns the content type implied by the payload signature, if any is recognized.
   *
   * @param bytes payload, possibly shorter than the header length
   * @return sniffed type, or empty when no signature matches
   */
  public Optional<String> sniff(byte[] bytes) {
    if (bytes == null || bytes.length < 3) {
      return Optional.empty();
    }

    if (startsWith(bytes, 0xFF, 0xD8, 0xFF)) {
      return Optional.of("image/jpeg");
    }
    if (startsWith(bytes, 0x89, 0x50, 0x4E, 0x47)) {
      return Optional.of("image/png");
    }
    if (startsWith(bytes, 0x47, 0x49, 0x46, 0x38)) {
      return Optional.of("image/gif");
    }
    if (startsWith(bytes, 0x52, 0x49, 0x46, 0x46)) {
      return riffType(bytes);
    }
    if (startsWith(bytes, 0x49, 0x44, 0x33)) {
      return Optional.of("audio/mpeg");
    }
    if (startsWith(bytes, 0xFF, 0xF1) || startsWith(bytes, 0xFF, 0xF9)) {
      return Optional.of("audio/aac");
    }
    if (startsWith(bytes, 0xFF, 0xFB)
        || startsWith(bytes, 0xFF, 0xF3)
        || startsWith(bytes, 0xFF, 0xF2)) {
      return Optional.of("audio/mpeg");
    }
    if (startsWith(bytes, 0x4F, 0x67, 0x67, 0x53)) {
      return Optional.of("audio/ogg");
    }
    if (asciiAt(bytes, 0, "#!AMR")) {
      return Optional.of("audio/amr");
    }
    if (asciiAt(bytes, 4, "ftyp")) {
      return Optional.of(isoMediaType(bytes));
    }
    if (startsWith(bytes, 0x1A, 0x45, 0xDF, 0xA3)) {
      return Optional.of("video/webm");
    }
    if (startsWith(bytes, 0x25, 0x50, 0x44, 0x46)) {
      return Optional.of("application/pdf");
    }
    if (startsWith(bytes, 0xD0, 0xCF, 0x11, 0xE0)) {
      return Optional.of("application/msword");
    }
    if (startsWith(bytes, 0x50, 0x4B, 0x03, 0x04)) {
      return Optional.of("application/zip");
    }
    return Optional.empty();
  }

  /**
   * Picks the type recorded for a blob: the sniffed type when recognized, else the declared type
   * without parameters, else {@value #FALLBACK_TYPE}.
   */
  public String resolve(byte[] bytes, String declaredContentType) {
    return sniff(bytes).orElseGet(() -> normalize(declaredContentType));
  }

  /** Whether the payload carries a known binary media signature. */
  public boolean isKnownBinary(byte[] bytes) {
    return sniff(bytes).isPresent();
  }

  /**
   * File extension registered for a content type, including the leading dot, or {@value
   * #DEFAULT_EXTENSION} when the type is missing or has none.
   */
  public String extensionFor(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return DEFAULT_EXTENSION;
    }
    try {
      String extension = mimeTypes.forName(normalize(contentType)).getExtension();
      return extension == null || extension.isEmpty() ? DEFAULT_EXTENSION : extension;
    } catch (MimeTypeException e) {
      log.debug("Unknown content type {}, using {}", contentType, DEFAULT_EXTENSION);
      return DEFAULT_EXTENSION;
    }
  }

  static String normalize(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return FALLBACK_TYPE;
    }
    int semicolon = contentType.indexOf(';');
    String bare = semicolon >= 0 ? contentType.substring(0, semicolon) : contentType;
    bare = bare.trim().toLowerCase(Locale.ROOT);
    return bare.isEmpty() ? FALLBACK_TYPE : bare;
  }

  private Optional<String> riffType(byte[] bytes) {
    if (asciiAt(bytes, 8, "WEBP")) {
      return Optional.of("image/webp");
    }
    if (asciiAt(bytes, 8, "WAVE")) {
      return Optional.of("audio/wav");
    }
    if (asciiAt(bytes, 8, "AVI ")) {
      return Optional.of("video/x-msvideo");
    }
    return Optional.empty();
  }

  private String isoMediaType(byte[] bytes) {
    if (asciiAt(bytes, 8, "qt  ")) {
      return "video/quicktime";
    }
    if (asciiAt(bytes, 8, "M4A ") || asciiAt(bytes, 8, "M4B ")) {
      return "audio/mp4";
    }
    if (asciiAt(bytes, 8, "3gp")) {
      return "video/3gpp";
    }
    return "video/mp4";
  }

  private static boolean startsWith(byte[] bytes, int... signature) {
    if (bytes.length < signature.length) {
      return false;
    }
    for (int i = 0; i < signature.length; i++) {
      if ((bytes[i] & 0xFF) != signature[i]) {
        return false;
      }
    }
    return true;
  }

  private static boolean asciiAt(byte[] bytes, int offset, String marker) {
    byte[] expected = marker.getBytes(StandardCharsets.US_ASCII);
    if (bytes.length < offset + expected.length) {
      return false;
    }
    for (int i = 0; i < expected.length; i++) {
      if (bytes[offset + i] != expected[i]) {
        return false;
      }
    }
    return true;
  }
}
