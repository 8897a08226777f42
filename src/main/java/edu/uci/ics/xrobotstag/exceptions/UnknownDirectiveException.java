package edu.uci.ics.xrobotstag.exceptions;

public class UnknownDirectiveException extends Exception {
  protected String directive;

  public UnknownDirectiveException(String directive) {
    super("Unknown directive: " + directive);
    this.directive = directive;
  }

  private static final long serialVersionUID = 6127393487251093716L;

  public String getDirective() {
    return this.directive;
  }
}
