package wolfsim.agents;

/** The four reasoning flows a response can take, with their closing questions. */
public enum RoleFlow {
  INVESTIGATE("investigation target", """
Think through your investigation choice:
1. Who remains uninvestigated among suspicious players?
2. Which player's role would provide the most valuable information?
3. How can you use this information to guide the village?
4. Should you reveal your role based on what you discover?"""),

  PROTECT("protection target", """
Consider your protection choice:
1. Who faces the highest risk tonight?
2. Have you protected yourself recently?
3. Which players seem most valuable to the village?
4. How can you avoid predictable protection patterns?"""),

  ELIMINATE("elimination target", """
Plan your elimination target:
1. Who poses the biggest threat to the werewolves?
2. Which elimination would cause maximum confusion?
3. How can we coordinate with other wolves?
4. Which target would least expose our identities?"""),

  DISCUSS("discussion contribution or vote", """
Consider for your response:
1. What patterns have emerged in recent discussions?
2. Which players' behaviors seem most suspicious?
3. How can you contribute valuable insights?
4. What evidence supports your suspicions?
5. How should you position yourself in the discussion?""");

  private final String actionType;
  private final String guidingQuestions;

  RoleFlow(String actionType, String guidingQuestions) {
    this.actionType = actionType;
    this.guidingQuestions = guidingQuestions;
  }

  public String actionType() { return actionType; }
  public String guidingQuestions() { return guidingQuestions; }
}
