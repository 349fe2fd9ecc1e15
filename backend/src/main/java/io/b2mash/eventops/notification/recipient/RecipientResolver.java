package io.b2mash.eventops.notification.recipient;

import io.b2mash.eventops.contact.ParentContact;
import io.b2mash.eventops.contact.ParentContactRepository;
import io.b2mash.eventops.contact.StaffMemberRepository;
import io.b2mash.eventops.contact.TeacherRepository;
import io.b2mash.eventops.event.SchoolClass;
import io.b2mash.eventops.event.SchoolClassRepository;
import io.b2mash.eventops.event.SchoolEvent;
import io.b2mash.eventops.notification.template.Audience;
import io.b2mash.eventops.registration.Registration;
import io.b2mash.eventops.registration.RegistrationRepository;
import io.b2mash.eventops.shop.PurchaseOrder;
import io.b2mash.eventops.shop.PurchaseOrderRepository;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a template's audiences into concrete recipients for one event.
 *
 * <p>Teachers fall back from linked teachers to the booking contact to assigned staff; the first
 * source yielding anyone wins. Parents come from the event's registrations. Non-buyers are the
 * parents without a paid order for the event. The combined list holds each email once.
 */
@Service
public class RecipientResolver {

  private static final Logger log = LoggerFactory.getLogger(RecipientResolver.class);

  static final String DEFAULT_CONTACT_NAME = "Kontaktperson";

  private final TeacherRepository teacherRepository;
  private final StaffMemberRepository staffMemberRepository;
  private final RegistrationRepository registrationRepository;
  private final ParentContactRepository parentContactRepository;
  private final SchoolClassRepository schoolClassRepository;
  private final PurchaseOrderRepository purchaseOrderRepository;

  public RecipientResolver(
      TeacherRepository teacherRepository,
      StaffMemberRepository staffMemberRepository,
      RegistrationRepository registrationRepository,
      ParentContactRepository parentContactRepository,
      SchoolClassRepository schoolClassRepository,
      PurchaseOrderRepository purchaseOrderRepository) {
    this.teacherRepository = teacherRepository;
    this.staffMemberRepository = staffMemberRepository;
    this.registrationRepository = registrationRepository;
    this.parentContactRepository = parentContactRepository;
    this.schoolClassRepository = schoolClassRepository;
    this.purchaseOrderRepository = purchaseOrderRepository;
  }

  /**
   * Resolves every audience of a template. Audiences are processed in declaration order and the
   * first occurrence of an email wins.
   */
  @Transactional(readOnly = true)
  public List<Recipient> resolve(SchoolEvent event, Collection<Audience> audiences) {
    var byEmail = new LinkedHashMap<String, Recipient>();
    for (var audience : audiences) {
      var recipients =
          switch (audience) {
            case TEACHER -> teachersFor(event);
            case PARENT -> parentsFor(event);
            case NON_BUYER -> nonBuyersFor(event);
          };
      for (var recipient : recipients) {
        byEmail.putIfAbsent(dedupKey(recipient), recipient);
      }
    }
    return List.copyOf(byEmail.values());
  }

  @Transactional(readOnly = true)
  public List<Recipient> teachersFor(SchoolEvent event) {
    var linked =
        teacherRepository.findAllById(event.getTeacherIds()).stream()
            .filter(t -> hasText(t.getEmail()))
            .map(t -> Recipient.teacher(t.getEmail(), t.getName(), event.getId()))
            .toList();
    if (!linked.isEmpty()) {
      return linked;
    }

    if (hasText(event.getContactEmail())) {
      String name =
          hasText(event.getContactName()) ? event.getContactName() : DEFAULT_CONTACT_NAME;
      return List.of(Recipient.teacher(event.getContactEmail(), name, event.getId()));
    }

    var staff =
        staffMemberRepository.findAllById(event.getStaffIds()).stream()
            .filter(s -> hasText(s.getEmail()))
            .map(s -> Recipient.teacher(s.getEmail(), s.getName(), event.getId()))
            .toList();
    if (staff.isEmpty()) {
      log.debug("No teacher-side recipient found for event {}", event.getId());
    }
    return staff;
  }

  @Transactional(readOnly = true)
  public List<Recipient> parentsFor(SchoolEvent event) {
    var registrations = registrationRepository.findByEventIdOrderByRegisteredAtAsc(event.getId());
    Set<UUID> parentIds =
        registrations.stream()
            .filter(r -> !r.isPlaceholder())
            .map(Registration::getParentId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    if (parentIds.isEmpty()) {
      return List.of();
    }

    Map<UUID, ParentContact> parents =
        parentContactRepository.findAllById(parentIds).stream()
            .collect(Collectors.toMap(ParentContact::getId, Function.identity()));
    Map<UUID, String> classNames =
        schoolClassRepository.findByEventId(event.getId()).stream()
            .collect(Collectors.toMap(SchoolClass::getId, SchoolClass::getClassName));

    var result = new ArrayList<Recipient>();
    var seenEmails = new HashSet<String>();
    for (var registration : registrations) {
      if (registration.isPlaceholder() || registration.getParentId() == null) {
        continue;
      }
      var parent = parents.get(registration.getParentId());
      if (parent == null || !hasText(parent.getEmail()) || parent.isEmailCampaignsOptOut()) {
        continue;
      }
      if (!seenEmails.add(normalize(parent.getEmail()))) {
        continue;
      }
      result.add(
          new Recipient(
              parent.getEmail(),
              parent.getFirstName(),
              RecipientType.PARENT,
              event.getId(),
              parent.getId(),
              registration.getChildName(),
              registration.getClassId() != null
                  ? classNames.get(registration.getClassId())
                  : null));
    }
    return result;
  }

  /**
   * Parents of the event that have not bought. A parent counts as a buyer when a paid order for the
   * event references their record, or a record with the same email.
   */
  @Transactional(readOnly = true)
  public List<Recipient> nonBuyersFor(SchoolEvent event) {
    var parents = parentsFor(event);
    if (parents.isEmpty()) {
      return List.of();
    }

    Set<UUID> buyerIds =
        paidOrdersFor(event).stream()
            .map(PurchaseOrder::getParentId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    if (buyerIds.isEmpty()) {
      return parents.stream().map(Recipient::asNonBuyer).toList();
    }
    Set<String> buyerEmails =
        parentContactRepository.findAllById(buyerIds).stream()
            .map(ParentContact::getEmail)
            .filter(RecipientResolver::hasText)
            .map(RecipientResolver::normalize)
            .collect(Collectors.toSet());

    return parents.stream()
        .filter(p -> !buyerIds.contains(p.parentId()))
        .filter(p -> !buyerEmails.contains(normalize(p.email())))
        .map(Recipient::asNonBuyer)
        .toList();
  }

  private List<PurchaseOrder> paidOrdersFor(SchoolEvent event) {
    var orders =
        new ArrayList<>(
            purchaseOrderRepository.findByEventIdAndPaymentStatus(
                event.getId(), PurchaseOrder.PAYMENT_STATUS_PAID));
    var classIds =
        schoolClassRepository.findByEventId(event.getId()).stream()
            .map(SchoolClass::getId)
            .toList();
    if (!classIds.isEmpty()) {
      Set<UUID> seen = orders.stream().map(PurchaseOrder::getId).collect(Collectors.toSet());
      purchaseOrderRepository
          .findByClassIdInAndPaymentStatus(classIds, PurchaseOrder.PAYMENT_STATUS_PAID)
          .stream()
          .filter(o -> seen.add(o.getId()))
          .forEach(orders::add);
    }
    return orders;
  }

  private static String dedupKey(Recipient recipient) {
    return normalize(recipient.email()) + "|" + recipient.eventId();
  }

  static String normalize(String email) {
    return email.trim().toLowerCase(Locale.ROOT);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
