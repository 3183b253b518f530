package org.marcdb.ingest_service.ingest;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.marcdb.ingest_service.Constants;
import org.marcdb.ingest_service.exceptions.IngestionException;

/**
 * Prints the prompt and reads one answer line. Only {@code y} and {@code yes} (any case) confirm;
 * an empty answer or end of input declines.
 */
@Slf4j
public class ConsoleConfirmationPrompt implements ConfirmationPrompt {

  private final BufferedReader in;
  private final PrintStream out;

  public ConsoleConfirmationPrompt() {
    this(System.in, System.out);
  }

  public ConsoleConfirmationPrompt(InputStream in, PrintStream out) {
    this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    this.out = out;
  }

  @Override
  public boolean confirm(String prompt) {
    out.print(prompt);
    out.flush();
    try {
      String answer = in.readLine();
      if (answer == null) {
        log.debug("No answer on standard input, declining");
        return false;
      }
      return Constants.AFFIRMATIVE_ANSWERS.contains(answer.trim().toLowerCase(Locale.ROOT));
    } catch (IOException e) {
      throw new IngestionException("Failed to read confirmation answer", e);
    }
  }
}
