package com.example.keyvaultclient.core;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;

/** Test logger that keeps every formatted record in memory. */
class RecordingLogger implements System.Logger {

  record Entry(Level level, String message) {}

  final List<Entry> entries = new ArrayList<>();

  @Override
  public String getName() {
    return "recording";
  }

  @Override
  public boolean isLoggable(final Level level) {
    return true;
  }

  @Override
  public void log(
      final Level level, final ResourceBundle bundle, final String msg, final Throwable thrown) {
    entries.add(new Entry(level, msg));
  }

  @Override
  public void log(
      final Level level, final ResourceBundle bundle, final String format, final Object... params) {
    entries.add(
        new Entry(level, params == null ? format : MessageFormat.format(format, params)));
  }

  List<Entry> at(final Level level) {
    return entries.stream().filter(e -> e.level() == level).toList();
  }
}
