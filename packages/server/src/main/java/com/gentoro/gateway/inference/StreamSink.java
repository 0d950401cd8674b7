package com.gentoro.gateway.inference;

import java.io.IOException;

/** Receives server-sent event frames, each already formatted as {@code data: ...\n\n}. */
@FunctionalInterface
public interface StreamSink {
  void send(String frame) throws IOException;
}
