package com.gentoro.gateway.attachment;

/** An uploaded file as a {@code data:} URL ready to be used in an {@code image_url} part. */
public record EncodedAttachment(String url, String mimeType, String filename, long size) {}
