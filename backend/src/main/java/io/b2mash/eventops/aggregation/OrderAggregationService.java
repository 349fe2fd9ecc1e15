package io.b2mash.eventops.aggregation;

import io.b2mash.eventops.event.SchoolClass;
import io.b2mash.eventops.event.SchoolClassRepository;
import io.b2mash.eventops.event.SchoolEvent;
import io.b2mash.eventops.event.SchoolEventRepository;
import io.b2mash.eventops.exception.InvalidStateException;
import io.b2mash.eventops.exception.ResourceNotFoundException;
import io.b2mash.eventops.schedule.EventDateCalculator;
import io.b2mash.eventops.schedule.UrgencyOrder;
import io.b2mash.eventops.shop.LineItem;
import io.b2mash.eventops.shop.PurchaseOrder;
import io.b2mash.eventops.shop.PurchaseOrderRepository;
import io.b2mash.eventops.supplierorder.OrderContentItem;
import io.b2mash.eventops.task.OrderEnrichment;
import io.b2mash.eventops.task.Task;
import io.b2mash.eventops.task.TaskCascadeService;
import io.b2mash.eventops.task.TaskCategory;
import io.b2mash.eventops.task.TaskCompletionData;
import io.b2mash.eventops.task.TaskCompletionResult;
import io.b2mash.eventops.task.TaskRepository;
import io.b2mash.eventops.task.TaskStatus;
import io.b2mash.eventops.task.TaskTemplateRegistry;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Groups shop orders by event for the supplier-order views. Each view picks the events inside its
 * visibility window, keeps the orders whose line items belong to the view's product category,
 * resolves every order to its event (directly or through its class) and sorts the resulting groups
 * most urgent first. Orders that cannot be resolved to a visible event are skipped.
 */
@Service
public class OrderAggregationService {

  private static final Logger log = LoggerFactory.getLogger(OrderAggregationService.class);

  /** Supplier order for clothing is due this many days before the event. */
  static final int CLOTHING_ORDER_DAY_OFFSET = 18;

  static final int CLOTHING_WINDOW_DAYS_AHEAD = 21;
  static final int CLOTHING_WINDOW_DAYS_PAST = 7;
  static final int MINICARD_WINDOW_DAYS = 30;

  /** Minicards are ordered the day after the event. */
  static final int MINICARD_DEADLINE_OFFSET = 1;

  static final String MINICARD_SKU = "minicard";

  private final SchoolEventRepository eventRepository;
  private final SchoolClassRepository classRepository;
  private final PurchaseOrderRepository purchaseOrderRepository;
  private final TaskRepository taskRepository;
  private final TaskTemplateRegistry templateRegistry;
  private final TaskCascadeService taskCascadeService;
  private final ClothingCatalog clothingCatalog;
  private final EventDateCalculator dateCalculator;

  public OrderAggregationService(
      SchoolEventRepository eventRepository,
      SchoolClassRepository classRepository,
      PurchaseOrderRepository purchaseOrderRepository,
      TaskRepository taskRepository,
      TaskTemplateRegistry templateRegistry,
      TaskCascadeService taskCascadeService,
      ClothingCatalog clothingCatalog,
      EventDateCalculator dateCalculator) {
    this.eventRepository = eventRepository;
    this.classRepository = classRepository;
    this.purchaseOrderRepository = purchaseOrderRepository;
    this.taskRepository = taskRepository;
    this.templateRegistry = templateRegistry;
    this.taskCascadeService = taskCascadeService;
    this.clothingCatalog = clothingCatalog;
    this.dateCalculator = dateCalculator;
  }

  /**
   * Events dated from 7 days ago through 21 days ahead whose clothing supplier order has not been
   * placed yet. The deadline is the order day, 18 days before the event.
   */
  @Transactional(readOnly = true)
  public List<EventOrderGroup> pendingClothingOrders() {
    var today = dateCalculator.today();
    var from = today.minusDays(CLOTHING_WINDOW_DAYS_PAST);
    var to = today.plusDays(CLOTHING_WINDOW_DAYS_AHEAD);
    var events = eventRepository.findByEventDateBetweenOrderByEventDateAsc(from, to);
    var eventIds = idsOf(events);
    if (eventIds.isEmpty()) {
      return List.of();
    }

    Set<UUID> alreadyOrdered =
        taskRepository
            .findByEventIdInAndCategoryAndStatus(
                eventIds, TaskCategory.CLOTHING_ORDER, TaskStatus.COMPLETED)
            .stream()
            .map(Task::getEventId)
            .collect(Collectors.toSet());
    var visible = events.stream().filter(e -> !alreadyOrdered.contains(e.getId())).toList();

    return aggregate(
        visible,
        item -> clothingCatalog.isClothing(item.numericVariantId()),
        event -> event.getEventDate().minusDays(CLOTHING_ORDER_DAY_OFFSET),
        this::sumClothing);
  }

  /**
   * Events dated within 30 days of today that still have a pending minicard task. The deadline is
   * the day after the event.
   */
  @Transactional(readOnly = true)
  public List<EventOrderGroup> pendingMinicardOrders() {
    var today = dateCalculator.today();
    var events =
        eventRepository.findByEventDateBetweenOrderByEventDateAsc(
            today.minusDays(MINICARD_WINDOW_DAYS), today.plusDays(MINICARD_WINDOW_DAYS));
    var eventIds = idsOf(events);
    if (eventIds.isEmpty()) {
      return List.of();
    }

    Set<UUID> withPendingTask =
        taskRepository
            .findByEventIdInAndTemplateIdAndStatus(
                eventIds, TaskTemplateRegistry.MINICARD_TEMPLATE_ID, TaskStatus.PENDING)
            .stream()
            .map(Task::getEventId)
            .collect(Collectors.toSet());
    var visible = events.stream().filter(e -> withPendingTask.contains(e.getId())).toList();

    return aggregate(
        visible,
        OrderAggregationService::isMinicard,
        event -> event.getEventDate().plusDays(MINICARD_DEADLINE_OFFSET),
        this::sumMinicards);
  }

  /**
   * Places the clothing supplier order for an event through the regular task cascade. The pending
   * clothing task is created first for events that predate task generation.
   */
  @Transactional
  public TaskCompletionResult completeClothingOrder(
      UUID eventId, BigDecimal amount, String notes, List<UUID> orderIds, String actor) {
    var event =
        eventRepository
            .findById(eventId)
            .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

    var group =
        pendingClothingOrders().stream().filter(g -> g.eventId().equals(eventId)).findFirst();
    List<UUID> sourceOrderIds =
        orderIds != null && !orderIds.isEmpty()
            ? orderIds
            : group.map(EventOrderGroup::orderIds).orElse(List.of());
    List<OrderContentItem> contents = group.map(EventOrderGroup::items).orElse(List.of());

    var task =
        taskRepository
            .findFirstByEventIdAndTemplateIdAndStatus(
                eventId, TaskTemplateRegistry.CLOTHING_TEMPLATE_ID, TaskStatus.PENDING)
            .orElseGet(() -> createClothingTask(event));

    return taskCascadeService.completeTask(
        task.getId(),
        new TaskCompletionData(amount, null, true, notes),
        actor,
        new OrderEnrichment(sourceOrderIds, contents));
  }

  private Task createClothingTask(SchoolEvent event) {
    if (event.getEventDate() == null) {
      throw InvalidStateException.eventWithoutDate(event.getId(), "create a clothing task");
    }
    var template =
        templateRegistry
            .find(TaskTemplateRegistry.CLOTHING_TEMPLATE_ID)
            .orElseThrow(() -> new IllegalStateException("Clothing task template missing"));
    var task =
        Task.fromTemplate(
            event.getId(),
            template,
            dateCalculator.deadlineFor(event.getEventDate(), template.offsetDays()));
    task = taskRepository.save(task);
    log.info("Created missing clothing task {} for event {}", task.getId(), event.getId());
    return task;
  }

  private List<EventOrderGroup> aggregate(
      List<SchoolEvent> events,
      Predicate<LineItem> inCategory,
      Function<SchoolEvent, LocalDate> deadlineOf,
      Function<List<LineItem>, List<OrderContentItem>> summarize) {
    if (events.isEmpty()) {
      return List.of();
    }
    Map<UUID, SchoolEvent> eventsById =
        events.stream().collect(Collectors.toMap(SchoolEvent::getId, Function.identity()));
    Map<UUID, UUID> classToEvent =
        classRepository.findByEventIdIn(eventsById.keySet()).stream()
            .collect(Collectors.toMap(SchoolClass::getId, SchoolClass::getEventId));

    Map<UUID, List<PurchaseOrder>> ordersByEvent = new LinkedHashMap<>();
    for (var order : candidateOrders(eventsById.keySet(), classToEvent.keySet())) {
      if (order.getLineItems().stream().noneMatch(inCategory)) {
        continue;
      }
      var eventId = resolveEventId(order, classToEvent);
      if (eventId == null || !eventsById.containsKey(eventId)) {
        log.debug("Skipping order {}: no visible event", order.getOrderNumber());
        continue;
      }
      ordersByEvent.computeIfAbsent(eventId, k -> new ArrayList<>()).add(order);
    }

    var groups = new ArrayList<EventOrderGroup>();
    for (var event : events) {
      var orders = ordersByEvent.get(event.getId());
      if (orders == null || orders.isEmpty()) {
        continue;
      }
      var matchingItems =
          orders.stream().flatMap(o -> o.getLineItems().stream()).filter(inCategory).toList();
      var revenue =
          matchingItems.stream()
              .map(LineItem::total)
              .filter(Objects::nonNull)
              .reduce(BigDecimal.ZERO, BigDecimal::add);
      var deadline = deadlineOf.apply(event);
      long days = dateCalculator.daysUntil(deadline);
      groups.add(
          new EventOrderGroup(
              event.getId(),
              event.getEventCode(),
              event.getSchoolName(),
              event.getEventDate(),
              deadline,
              days,
              days < 0,
              orders.size(),
              revenue,
              summarize.apply(matchingItems),
              orders.stream().map(PurchaseOrder::getId).toList()));
    }

    groups.sort(UrgencyOrder.mostUrgentFirst(EventOrderGroup::daysUntilDeadline));
    return groups;
  }

  private List<PurchaseOrder> candidateOrders(
      Collection<UUID> eventIds, Collection<UUID> classIds) {
    Map<UUID, PurchaseOrder> byId = new LinkedHashMap<>();
    purchaseOrderRepository.findByEventIdIn(eventIds).forEach(o -> byId.put(o.getId(), o));
    if (!classIds.isEmpty()) {
      purchaseOrderRepository
          .findByClassIdIn(classIds)
          .forEach(o -> byId.putIfAbsent(o.getId(), o));
    }
    return new ArrayList<>(byId.values());
  }

  /** Direct event link first, then the event of the order's class; null when neither resolves. */
  static UUID resolveEventId(PurchaseOrder order, Map<UUID, UUID> classToEvent) {
    if (order.getEventId() != null) {
      return order.getEventId();
    }
    if (order.getClassId() != null) {
      return classToEvent.get(order.getClassId());
    }
    return null;
  }

  private List<OrderContentItem> sumClothing(List<LineItem> items) {
    Map<String, Integer> quantities = new LinkedHashMap<>();
    Map<String, String> names = new LinkedHashMap<>();
    for (var type : ClothingCatalog.ClothingType.values()) {
      var sizes =
          type == ClothingCatalog.ClothingType.TSHIRT
              ? ClothingCatalog.TSHIRT_SIZES
              : ClothingCatalog.HOODIE_SIZES;
      for (var size : sizes) {
        var variant = new ClothingCatalog.ClothingVariant(type, size);
        quantities.put(variant.sku(), 0);
        names.put(variant.sku(), variant.displayName());
      }
    }
    for (var item : items) {
      clothingCatalog
          .lookup(item.numericVariantId())
          .ifPresent(v -> quantities.merge(v.sku(), item.quantity(), Integer::sum));
    }
    return quantities.entrySet().stream()
        .filter(e -> e.getValue() > 0)
        .map(e -> new OrderContentItem(e.getKey(), names.get(e.getKey()), e.getValue()))
        .toList();
  }

  private List<OrderContentItem> sumMinicards(List<LineItem> items) {
    int total = items.stream().mapToInt(LineItem::quantity).sum();
    return List.of(new OrderContentItem(MINICARD_SKU, "Minicard", total));
  }

  private static boolean isMinicard(LineItem item) {
    return item.productTitle() != null
        && item.productTitle().toLowerCase(Locale.ROOT).contains(MINICARD_SKU);
  }

  private static List<UUID> idsOf(List<SchoolEvent> events) {
    return events.stream().map(SchoolEvent::getId).toList();
  }
}
