package wolfsim.metrics;

public record GameMetrics(
    int totalGames,
    int wins,
    int losses,
    int responseFailures,
    double survivalRate,
    double winRate,
    double failureRate
) {
  public static GameMetrics of(int totalGames, int wins, int survivals, int responseFailures) {
    return new GameMetrics(
        totalGames,
        wins,
        totalGames - wins,
        responseFailures,
        ratio(survivals, totalGames),
        ratio(wins, totalGames),
        ratio(responseFailures, totalGames)
    );
  }

  private static double ratio(int count, int total) {
    return total > 0 ? (double) count / total : 0.0;
  }

  public String summary() {
    return """
Results over %d games:
Win Rate: %.2f%%
Survival Rate: %.2f%%
Response Failure Rate: %.2f%%
Total Wins: %d
Total Losses: %d
Total Response Failures: %d""".formatted(totalGames, winRate * 100, survivalRate * 100, failureRate * 100,
        wins, losses, responseFailures);
  }
}
