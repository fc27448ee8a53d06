package com.github.hdlfsm;

/**
 * This class encapsulates the parameters of one hdl generation request. Use the
 * {@code GenerationConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. entityName is the name of the generated hdl entity, "MooreFSM" unless set. It has to be a valid
 * identifier, see {@link HdlIdentifier}.<br>
 * 2. testbench tells the template collaborator to emit a testbench instead of the machine itself.
 * The model handed over is the same either way.<br>
 * 3. the require* switches decide which validity checks {@link FiniteStateMachine#toHdlModel}
 * enforces before handing the machine over. Only the state set check is on by default.<br>
 */
public final class GenerationConfiguration {
  public static final String DEFAULT_ENTITY_NAME = "MooreFSM";

  private final String entityName;
  private final boolean testbench;
  private final boolean requireValidStates;
  private final boolean requireReachability;
  private final boolean requireDefaultState;

  public String getEntityName() {
    return entityName;
  }

  public boolean isTestbench() {
    return testbench;
  }

  public boolean isRequireValidStates() {
    return requireValidStates;
  }

  public boolean isRequireReachability() {
    return requireReachability;
  }

  public boolean isRequireDefaultState() {
    return requireDefaultState;
  }

  public final static class GenerationConfigurationBuilder {
    private String entityName = DEFAULT_ENTITY_NAME;
    private boolean testbench;
    private boolean requireValidStates = true;
    private boolean requireReachability;
    private boolean requireDefaultState;

    public static GenerationConfigurationBuilder newBuilder() {
      return new GenerationConfigurationBuilder();
    }

    public GenerationConfigurationBuilder entityName(final String entityName) {
      this.entityName = entityName;
      return this;
    }

    public GenerationConfigurationBuilder testbench(final boolean testbench) {
      this.testbench = testbench;
      return this;
    }

    public GenerationConfigurationBuilder requireValidStates(final boolean requireValidStates) {
      this.requireValidStates = requireValidStates;
      return this;
    }

    public GenerationConfigurationBuilder requireReachability(final boolean requireReachability) {
      this.requireReachability = requireReachability;
      return this;
    }

    public GenerationConfigurationBuilder requireDefaultState(final boolean requireDefaultState) {
      this.requireDefaultState = requireDefaultState;
      return this;
    }

    public GenerationConfiguration build() throws FsmException {
      final GenerationConfiguration config = new GenerationConfiguration(entityName, testbench,
          requireValidStates, requireReachability, requireDefaultState);
      config.validate();
      return config;
    }

    private GenerationConfigurationBuilder() {}
  }

  private void validate() throws FsmException {
    StringBuilder messages = new StringBuilder();
    if (entityName == null) {
      messages.append("Entity name cannot be null. ");
    } else if (!HdlIdentifier.isValid(entityName)) {
      messages.append("Entity name '").append(entityName).append("' is not a valid identifier. ");
    }
    if (messages.length() > 0) {
      throw new FsmException(FsmException.Code.INVALID_GENERATION_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "GenerationConfiguration [entityName=" + entityName + ", testbench=" + testbench
        + ", requireValidStates=" + requireValidStates + ", requireReachability="
        + requireReachability + ", requireDefaultState=" + requireDefaultState + "]";
  }

  private GenerationConfiguration(final String entityName, final boolean testbench,
      final boolean requireValidStates, final boolean requireReachability,
      final boolean requireDefaultState) {
    this.entityName = entityName;
    this.testbench = testbench;
    this.requireValidStates = requireValidStates;
    this.requireReachability = requireReachability;
    this.requireDefaultState = requireDefaultState;
  }

}
