package com.pld.mft.templates;

/** Path segments and registry keys of the upload templates. */
public final class TemplateTypes {

  public static final String MASTER_DATA = "master-data";

  private TemplateTypes() {}
}
