package io.b2mash.eventops.task;

import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** The fixed, ordered checklist generated for every event. */
@Component
public class TaskTemplateRegistry {

  public static final String CLOTHING_TEMPLATE_ID = "order_schul_shirts";
  public static final String MINICARD_TEMPLATE_ID = "minicard";

  static final String FOLLOW_UP_PREFIX = "shipping_";
  static final String FOLLOW_UP_NAME = "Ship Order To School";
  static final String FOLLOW_UP_DESCRIPTION = "Confirm shipment of materials to school";

  private static final List<TaskTemplate> TEMPLATES =
      List.of(
          new TaskTemplate(
              "poster_letter",
              TaskCategory.PAPER_ORDER,
              "Poster & Letter To School",
              "Send poster and customized letter to school for event promotion",
              CompletionKind.SUBMIT_ONLY,
              -58,
              true,
              true),
          new TaskTemplate(
              "flyer1",
              TaskCategory.PAPER_ORDER,
              "Order 'Flyer One' To School",
              "Place print order for Flyer 1 - first wave of event materials",
              CompletionKind.MONETARY,
              -42,
              true,
              true),
          new TaskTemplate(
              "flyer2",
              TaskCategory.PAPER_ORDER,
              "Order 'Flyer Two' To School",
              "Place print order for Flyer 2 - second wave of event materials",
              CompletionKind.MONETARY,
              -22,
              true,
              true),
          new TaskTemplate(
              CLOTHING_TEMPLATE_ID,
              TaskCategory.CLOTHING_ORDER,
              "Order School T-Shirts & Hoodies",
              "Order personalised t-shirts and hoodies from the supplier",
              CompletionKind.MONETARY,
              -18,
              true,
              true),
          new TaskTemplate(
              "flyer3",
              TaskCategory.PAPER_ORDER,
              "Flyer Three",
              "Place print order for Flyer 3 - final wave of event materials",
              CompletionKind.MONETARY,
              -14,
              true,
              true),
          new TaskTemplate(
              MINICARD_TEMPLATE_ID,
              TaskCategory.PAPER_ORDER,
              "Minicard To Office",
              "Order minicards for post-event distribution to parents",
              CompletionKind.MONETARY,
              1,
              false,
              false));

  public List<TaskTemplate> all() {
    return TEMPLATES;
  }

  /** Looks up a template by id. Follow-up and manual tasks have no registry entry. */
  public Optional<TaskTemplate> find(String templateId) {
    return TEMPLATES.stream().filter(t -> t.id().equals(templateId)).findFirst();
  }

  public String followUpTemplateId(TaskTemplate parent) {
    return FOLLOW_UP_PREFIX + parent.id();
  }
}
