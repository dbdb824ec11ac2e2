package com.contextsmith.daac;

/** The double array would outgrow the addressable (or configured) size. */
public class ConstructionOverflowException extends ConstructionException {
  private static final long serialVersionUID = 1873045726730158312L;

  public ConstructionOverflowException(String message) {
    super(message);
  }
}
