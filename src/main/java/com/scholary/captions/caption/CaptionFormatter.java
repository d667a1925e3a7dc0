package com.scholary.captions.caption;

import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.Transcript;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Renders transcripts as SubRip (SRT) or WebVTT caption files.
 *
 * <p>SRT:
 *
 * <pre>
 * 1
 * 00:00:00,000 --> 00:00:05,200
 * Hello world
 *
 * 2
 * 00:00:05,200 --> 00:00:10,300
 * [♪ Soft piano ♪]
 * </pre>
 *
 * <p>WebVTT:
 *
 * <pre>
 * WEBVTT
 *
 * cue-1
 * 00:00:00.000 --> 00:00:05.200
 * Hello world
 * </pre>
 *
 * <p>Non-speech cues are decorated by kind: music as {@code [♪ text ♪]}, sound as {@code [Sound:
 * text]}, silence as {@code [text]}, unless the text already carries its brackets. In WebVTT the
 * brackets added to music are italic and those added to sound are bold.
 */
@Component
public class CaptionFormatter {

  private static final Pattern BLANK_LINES = Pattern.compile("\\R\\s*\\R+");

  /** Render a transcript in the given format. */
  public String format(Transcript transcript, CaptionFormat format) {
    return format(transcript.segments(), format);
  }

  /**
   * Render segments in the given format.
   *
   * <p>Segments are stable-sorted by start time first, so the output is always in time order.
   */
  public String format(List<Segment> segments, CaptionFormat format) {
    List<Segment> sorted = new ArrayList<>(segments);
    sorted.sort(Comparator.comparingDouble(Segment::startSec));
    return format == CaptionFormat.VTT ? toVtt(sorted) : toSrt(sorted);
  }

  /**
   * Render segments in the named format.
   *
   * @throws IllegalArgumentException if the format name is not supported
   */
  public String format(Transcript transcript, String formatName) {
    return format(transcript, CaptionFormat.fromName(formatName));
  }

  private String toSrt(List<Segment> segments) {
    StringBuilder srt = new StringBuilder();
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      srt.append(i + 1).append("\n");
      srt.append(formatTimestamp(segment.startSec(), ','))
          .append(" --> ")
          .append(formatTimestamp(segment.endSec(), ','))
          .append("\n");
      srt.append(srtText(segment)).append("\n");
      srt.append("\n");
    }
    return srt.toString();
  }

  private String toVtt(List<Segment> segments) {
    StringBuilder vtt = new StringBuilder("WEBVTT\n\n");
    for (int i = 0; i < segments.size(); i++) {
      Segment segment = segments.get(i);
      vtt.append("cue-").append(i + 1).append("\n");
      vtt.append(formatTimestamp(segment.startSec(), '.'))
          .append(" --> ")
          .append(formatTimestamp(segment.endSec(), '.'))
          .append("\n");
      vtt.append(vttText(segment)).append("\n");
      vtt.append("\n");
    }
    return vtt.toString();
  }

  private static String srtText(Segment segment) {
    String text = collapseBlankLines(segment.text());
    switch (segment.kind()) {
      case MUSIC:
        return text.startsWith("[♪") ? text : "[♪ " + text + " ♪]";
      case SOUND:
        return text.startsWith("[Sound:") ? text : "[Sound: " + text + "]";
      case SILENCE:
        return text.startsWith("[") ? text : "[" + text + "]";
      default:
        return text;
    }
  }

  private static String vttText(Segment segment) {
    String text = collapseBlankLines(segment.text());
    switch (segment.kind()) {
      case MUSIC:
        return text.startsWith("[♪") ? text : "<i>[♪ " + text + " ♪]</i>";
      case SOUND:
        return text.startsWith("[Sound:") ? text : "<b>[Sound: " + text + "]</b>";
      case SILENCE:
        return text.startsWith("[") ? text : "[" + text + "]";
      default:
        return text;
    }
  }

  /** A blank line would end the cue early, so runs of line breaks become a single one. */
  private static String collapseBlankLines(String text) {
    return BLANK_LINES.matcher(text.strip()).replaceAll("\n");
  }

  /**
   * Format seconds as {@code HH:MM:SS<sep>mmm}.
   *
   * <p>Milliseconds are rounded and capped at 999, with no carry into seconds: 2.3 renders as
   * {@code 00:00:02,300} and 59.9996 as {@code 00:00:59,999}.
   */
  static String formatTimestamp(double seconds, char millisSeparator) {
    int hours = (int) Math.floor(seconds / 3600);
    double remainder = seconds % 3600;
    int minutes = (int) Math.floor(remainder / 60);
    double secondsInMinute = remainder % 60;
    int secs = (int) Math.floor(secondsInMinute);
    int millis = Math.min(999, (int) Math.round((secondsInMinute % 1) * 1000));

    return String.format(
        Locale.ROOT, "%02d:%02d:%02d%c%03d", hours, minutes, secs, millisSeparator, millis);
  }
}
