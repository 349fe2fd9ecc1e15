package io.b2mash.eventops.aggregation;

import static io.b2mash.eventops.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.eventops.event.SchoolClass;
import io.b2mash.eventops.event.SchoolClassRepository;
import io.b2mash.eventops.event.SchoolEvent;
import io.b2mash.eventops.event.SchoolEventRepository;
import io.b2mash.eventops.schedule.EventDateCalculator;
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
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OrderAggregationServiceTest {

  private static final LocalDate TODAY = LocalDate.of(2026, 3, 1);
  private static final String TSHIRT_98 = "gid://shopify/ProductVariant/53328502194522";
  private static final String HOODIE_128 = "gid://shopify/ProductVariant/53328494821722";

  @Mock private SchoolEventRepository eventRepository;
  @Mock private SchoolClassRepository classRepository;
  @Mock private PurchaseOrderRepository purchaseOrderRepository;
  @Mock private TaskRepository taskRepository;
  @Mock private TaskCascadeService taskCascadeService;

  private final TaskTemplateRegistry templateRegistry = new TaskTemplateRegistry();
  private OrderAggregationService service;

  @BeforeEach
  void setUp() {
    var clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneId.of("Europe/Berlin"));
    service =
        new OrderAggregationService(
            eventRepository,
            classRepository,
            purchaseOrderRepository,
            taskRepository,
            templateRegistry,
            taskCascadeService,
            new ClothingCatalog(),
            new EventDateCalculator(clock));
  }

  @Test
  void clothing_groupsByEventAndSortsMostUrgentFirst() {
    var soon = event("EVT-A", LocalDate.of(2026, 3, 21));
    var overdue = event("EVT-B", LocalDate.of(2026, 3, 5));
    var alreadyOrdered = event("EVT-C", LocalDate.of(2026, 3, 10));
    var classB = withId(new SchoolClass(overdue.getId(), "Klasse 2b"), UUID.randomUUID());

    when(eventRepository.findByEventDateBetweenOrderByEventDateAsc(
            TODAY.minusDays(7), TODAY.plusDays(21)))
        .thenReturn(List.of(overdue, alreadyOrdered, soon));
    var completedClothingTask =
        Task.fromTemplate(
            alreadyOrdered.getId(),
            templateRegistry.find(TaskTemplateRegistry.CLOTHING_TEMPLATE_ID).orElseThrow(),
            LocalDate.of(2026, 2, 20));
    when(taskRepository.findByEventIdInAndCategoryAndStatus(
            anyCollection(), eq(TaskCategory.CLOTHING_ORDER), eq(TaskStatus.COMPLETED)))
        .thenReturn(List.of(completedClothingTask));
    when(classRepository.findByEventIdIn(anyCollection())).thenReturn(List.of(classB));

    var direct =
        order(
            soon.getId(), null, new LineItem(TSHIRT_98, "Schul-T-Shirt", 2, new BigDecimal("50")));
    var paperOnly =
        order(soon.getId(), null, new LineItem("gid://shopify/ProductVariant/1", "CD", 1, null));
    var viaClass =
        order(null, classB.getId(), new LineItem(HOODIE_128, "Hoodie", 1, new BigDecimal("35")));
    var hiddenEvent =
        order(alreadyOrdered.getId(), null, new LineItem(TSHIRT_98, "Schul-T-Shirt", 5, null));
    when(purchaseOrderRepository.findByEventIdIn(anyCollection()))
        .thenReturn(List.of(direct, paperOnly, hiddenEvent));
    when(purchaseOrderRepository.findByClassIdIn(anyCollection())).thenReturn(List.of(viaClass));

    var groups = service.pendingClothingOrders();

    assertThat(groups).extracting(EventOrderGroup::eventCode).containsExactly("EVT-B", "EVT-A");

    var overdueGroup = groups.get(0);
    assertThat(overdueGroup.deadline()).isEqualTo(LocalDate.of(2026, 2, 15));
    assertThat(overdueGroup.overdue()).isTrue();
    assertThat(overdueGroup.daysUntilDeadline()).isEqualTo(-14);
    assertThat(overdueGroup.items())
        .containsExactly(new OrderContentItem("hoodie-128", "Hoodie 128", 1));

    var soonGroup = groups.get(1);
    assertThat(soonGroup.deadline()).isEqualTo(LocalDate.of(2026, 3, 3));
    assertThat(soonGroup.overdue()).isFalse();
    assertThat(soonGroup.totalOrders()).isEqualTo(1);
    assertThat(soonGroup.totalRevenue()).isEqualByComparingTo("50");
    assertThat(soonGroup.orderIds()).containsExactly(direct.getId());
  }

  @Test
  void minicards_onlyForEventsWithPendingMinicardTask() {
    var withTask = event("EVT-M", LocalDate.of(2026, 2, 27));
    var withoutTask = event("EVT-N", LocalDate.of(2026, 2, 26));
    when(eventRepository.findByEventDateBetweenOrderByEventDateAsc(
            TODAY.minusDays(30), TODAY.plusDays(30)))
        .thenReturn(List.of(withoutTask, withTask));
    var minicardTask =
        Task.fromTemplate(
            withTask.getId(),
            templateRegistry.find(TaskTemplateRegistry.MINICARD_TEMPLATE_ID).orElseThrow(),
            LocalDate.of(2026, 2, 28));
    when(taskRepository.findByEventIdInAndTemplateIdAndStatus(
            anyCollection(),
            eq(TaskTemplateRegistry.MINICARD_TEMPLATE_ID),
            eq(TaskStatus.PENDING)))
        .thenReturn(List.of(minicardTask));
    when(classRepository.findByEventIdIn(anyCollection())).thenReturn(List.of());
    when(purchaseOrderRepository.findByEventIdIn(anyCollection()))
        .thenReturn(
            List.of(
                order(withTask.getId(), null, new LineItem("v/1", "Minicard Set", 3, null)),
                order(withTask.getId(), null, new LineItem("v/2", "MINICARD", 2, null))));

    var groups = service.pendingMinicardOrders();

    assertThat(groups)
        .singleElement()
        .satisfies(
            g -> {
              assertThat(g.eventCode()).isEqualTo("EVT-M");
              assertThat(g.deadline()).isEqualTo(LocalDate.of(2026, 2, 28));
              assertThat(g.daysUntilDeadline()).isEqualTo(-1);
              assertThat(g.items())
                  .containsExactly(new OrderContentItem("minicard", "Minicard", 5));
            });
  }

  @Test
  void completeClothingOrder_createsMissingTaskAndCompletesIt() {
    var event = event("EVT-A", LocalDate.of(2026, 5, 10));
    var orderIds = List.of(UUID.randomUUID());
    when(eventRepository.findById(event.getId())).thenReturn(Optional.of(event));
    when(eventRepository.findByEventDateBetweenOrderByEventDateAsc(any(), any()))
        .thenReturn(List.of());
    when(taskRepository.findFirstByEventIdAndTemplateIdAndStatus(
            event.getId(), TaskTemplateRegistry.CLOTHING_TEMPLATE_ID, TaskStatus.PENDING))
        .thenReturn(Optional.empty());
    var taskId = UUID.randomUUID();
    when(taskRepository.save(any(Task.class)))
        .thenAnswer(inv -> withId(inv.<Task>getArgument(0), taskId));
    var expected = new TaskCompletionResult(null, UUID.randomUUID(), UUID.randomUUID());
    when(taskCascadeService.completeTask(eq(taskId), any(), eq("ops@minimusiker.de"), any()))
        .thenReturn(expected);

    var result =
        service.completeClothingOrder(
            event.getId(), new BigDecimal("320.00"), "Lieferant X", orderIds, "ops@minimusiker.de");

    assertThat(result).isEqualTo(expected);
    var savedTask = ArgumentCaptor.forClass(Task.class);
    verify(taskRepository).save(savedTask.capture());
    assertThat(savedTask.getValue().getDeadline()).isEqualTo(LocalDate.of(2026, 4, 22));

    var data = ArgumentCaptor.forClass(TaskCompletionData.class);
    var enrichment = ArgumentCaptor.forClass(OrderEnrichment.class);
    verify(taskCascadeService)
        .completeTask(eq(taskId), data.capture(), eq("ops@minimusiker.de"), enrichment.capture());
    assertThat(data.getValue().amount()).isEqualByComparingTo("320.00");
    assertThat(data.getValue().confirmed()).isTrue();
    assertThat(enrichment.getValue().sourceOrderIds()).isEqualTo(orderIds);
  }

  @Test
  void resolveEventId_prefersDirectLinkThenClass() {
    var eventId = UUID.randomUUID();
    var classId = UUID.randomUUID();
    var classEvent = UUID.randomUUID();
    var map = Map.of(classId, classEvent);

    assertThat(OrderAggregationService.resolveEventId(order(eventId, classId), map))
        .isEqualTo(eventId);
    assertThat(OrderAggregationService.resolveEventId(order(null, classId), map))
        .isEqualTo(classEvent);
    assertThat(OrderAggregationService.resolveEventId(order(null, UUID.randomUUID()), map))
        .isNull();
    assertThat(OrderAggregationService.resolveEventId(order(null, null), map)).isNull();
  }

  private static SchoolEvent event(String code, LocalDate date) {
    return withId(new SchoolEvent(code, "Schule " + code, date), UUID.randomUUID());
  }

  private static PurchaseOrder order(UUID eventId, UUID classId, LineItem... items) {
    return new PurchaseOrder(
        UUID.randomUUID(),
        "#" + Math.abs(UUID.randomUUID().hashCode() % 10000),
        Instant.parse("2026-02-20T12:00:00Z"),
        PurchaseOrder.PAYMENT_STATUS_PAID,
        eventId,
        classId,
        null,
        BigDecimal.TEN,
        List.of(items));
  }
}
