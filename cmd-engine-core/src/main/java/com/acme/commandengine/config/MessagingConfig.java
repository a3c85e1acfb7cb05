package com.acme.commandengine.config;

/**
 * Topic naming for the two outgoing buses. Pure POJO - no framework dependencies.
 */
public class MessagingConfig {

  private TopicNaming topicNaming = new TopicNaming();

  public TopicNaming getTopicNaming() {
    return topicNaming;
  }

  public void setTopicNaming(TopicNaming topicNaming) {
    this.topicNaming = topicNaming;
  }

  public static class TopicNaming {
    private String eventTopic = "events";
    private String flowTopic = "flows";
    private boolean perContext = false;

    public String getEventTopic() {
      return eventTopic;
    }

    public void setEventTopic(String eventTopic) {
      this.eventTopic = eventTopic;
    }

    public String getFlowTopic() {
      return flowTopic;
    }

    public void setFlowTopic(String flowTopic) {
      this.flowTopic = flowTopic;
    }

    public boolean isPerContext() {
      return perContext;
    }

    public void setPerContext(boolean perContext) {
      this.perContext = perContext;
    }

    /** Example: events + planning -> events.planning when per-context naming is on. */
    public String buildTopic(String baseTopic, String contextName) {
      return perContext ? baseTopic + "." + contextName : baseTopic;
    }
  }
}
