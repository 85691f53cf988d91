package io.nestor.parser.impl;

/** Receives {@link ScanEvent}s as {@link Scanner} produces them. */
@FunctionalInterface
public interface ScanEventSink {
  void accept(ScanEvent event);
}
