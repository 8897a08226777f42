package edu.uci.ics.xrobotstag.exceptions;

/**
 * Thrown when the HTTP headers of a URL could not be retrieved.
 */
public class HeaderFetchException extends Exception {
  protected String url;

  public HeaderFetchException(String message, String url) {
    super(message);
    this.url = url;
  }

  public HeaderFetchException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = url;
  }

  private static final long serialVersionUID = 8304417513530261934L;

  public String getURL() {
    return this.url;
  }
}
