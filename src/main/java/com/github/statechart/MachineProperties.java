package com.github.statechart;

/**
 * Machine-wide settings persisted at the document root. The language tag is cosmetic; every code
 * fragment here is opaque text.
 */
public final class MachineProperties {
  private String language = "";
  private String includes = "";
  private String context = "";
  private String contextInit = "";
  private String entry = "";
  private String exit = "";
  private String doAction = "";
  private Hooks hooks = new Hooks();
  // id of the initial top-level state
  private String initial;
  private Marker initialMarker;
  private Marker historyMarker;

  public MachineProperties copy() {
    final MachineProperties copy = new MachineProperties();
    copy.language = language;
    copy.includes = includes;
    copy.context = context;
    copy.contextInit = contextInit;
    copy.entry = entry;
    copy.exit = exit;
    copy.doAction = doAction;
    copy.hooks = hooks.copy();
    copy.initial = initial;
    copy.initialMarker = initialMarker;
    copy.historyMarker = historyMarker;
    return copy;
  }

  public String getLanguage() {
    return language;
  }

  public void setLanguage(final String language) {
    this.language = orEmpty(language);
  }

  public String getIncludes() {
    return includes;
  }

  public void setIncludes(final String includes) {
    this.includes = orEmpty(includes);
  }

  public String getContext() {
    return context;
  }

  public void setContext(final String context) {
    this.context = orEmpty(context);
  }

  public String getContextInit() {
    return contextInit;
  }

  public void setContextInit(final String contextInit) {
    this.contextInit = orEmpty(contextInit);
  }

  public String getEntry() {
    return entry;
  }

  public void setEntry(final String entry) {
    this.entry = orEmpty(entry);
  }

  public String getExit() {
    return exit;
  }

  public void setExit(final String exit) {
    this.exit = orEmpty(exit);
  }

  public String getDoAction() {
    return doAction;
  }

  public void setDoAction(final String doAction) {
    this.doAction = orEmpty(doAction);
  }

  public Hooks getHooks() {
    return hooks;
  }

  public void setHooks(final Hooks hooks) {
    this.hooks = hooks == null ? new Hooks() : hooks;
  }

  public String getInitial() {
    return initial;
  }

  public void setInitial(final String initial) {
    this.initial = initial;
  }

  public Marker getInitialMarker() {
    return initialMarker;
  }

  public void setInitialMarker(final Marker initialMarker) {
    this.initialMarker = initialMarker;
  }

  public Marker getHistoryMarker() {
    return historyMarker;
  }

  public void setHistoryMarker(final Marker historyMarker) {
    this.historyMarker = historyMarker;
  }

  @Override
  public String toString() {
    return "MachineProperties [language=" + language + ", initial=" + initial + ", hooks="
        + hooks + "]";
  }

  static String orEmpty(final String value) {
    return value == null ? "" : value;
  }

  /**
   * Code applied implicitly to every state (entry/exit/do) and to every transition.
   */
  public static final class Hooks {
    private String entry = "";
    private String exit = "";
    private String doAction = "";
    private String transition = "";

    public Hooks copy() {
      final Hooks copy = new Hooks();
      copy.entry = entry;
      copy.exit = exit;
      copy.doAction = doAction;
      copy.transition = transition;
      return copy;
    }

    public String getEntry() {
      return entry;
    }

    public void setEntry(final String entry) {
      this.entry = orEmpty(entry);
    }

    public String getExit() {
      return exit;
    }

    public void setExit(final String exit) {
      this.exit = orEmpty(exit);
    }

    public String getDoAction() {
      return doAction;
    }

    public void setDoAction(final String doAction) {
      this.doAction = orEmpty(doAction);
    }

    public String getTransition() {
      return transition;
    }

    public void setTransition(final String transition) {
      this.transition = orEmpty(transition);
    }

    @Override
    public String toString() {
      return "Hooks [entry=" + entry + ", exit=" + exit + ", do=" + doAction + ", transition="
          + transition + "]";
    }
  }
}
