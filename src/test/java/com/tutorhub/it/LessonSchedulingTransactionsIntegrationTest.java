package com.tutorhub.it;

import com.tutorhub.exception.CannotBeScheduledException;
import com.tutorhub.model.CalendarEntry;
import com.tutorhub.model.Customer;
import com.tutorhub.model.Lesson;
import com.tutorhub.model.LessonEntitlement;
import com.tutorhub.model.LessonType;
import com.tutorhub.model.Teacher;
import com.tutorhub.repository.CalendarEntryRepository;
import com.tutorhub.repository.CustomerRepository;
import com.tutorhub.repository.LessonEntitlementRepository;
import com.tutorhub.repository.LessonRepository;
import com.tutorhub.repository.TeacherRepository;
import com.tutorhub.repository.WorkingHoursRepository;
import com.tutorhub.service.CalendarEntryService;
import com.tutorhub.service.CustomerService;
import com.tutorhub.service.FreeSlotService;
import com.tutorhub.service.LessonEntitlementService;
import com.tutorhub.service.LessonSchedulingService;
import com.tutorhub.service.TeacherAvailabilityService;
import com.tutorhub.service.WorkingHoursService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

/**
 * Services called the way a web layer calls them: no surrounding transaction, detached entities
 * in and out. Data is committed, so every test cleans up after itself.
 */
@SpringBootTest
class LessonSchedulingTransactionsIntegrationTest {

    @Autowired LessonSchedulingService schedulingService;
    @Autowired LessonEntitlementService entitlementService;
    @Autowired FreeSlotService freeSlotService;
    @Autowired TeacherAvailabilityService availabilityService;
    @Autowired WorkingHoursService workingHoursService;
    @Autowired CustomerService customerService;

    @SpyBean CalendarEntryService calendarEntryService;

    @Autowired TeacherRepository teacherRepo;
    @Autowired WorkingHoursRepository workingHoursRepo;
    @Autowired CustomerRepository customerRepo;
    @Autowired LessonRepository lessonRepo;
    @Autowired CalendarEntryRepository entryRepo;
    @Autowired LessonEntitlementRepository entitlementRepo;

    // Monday, teacher works 13:00-15:00
    private final LocalDate monday = LocalDate.of(2016, 7, 18);

    private Teacher teacher;
    private Lesson ordinary;
    private Lesson masterClass;

    @BeforeEach
    void setUp() {
        teacher = new Teacher();
        teacher.setFirstName("Fedor");
        teacher.setLastName("Testov");
        teacher = teacherRepo.save(teacher);
        workingHoursService.add(teacher, 0, LocalTime.of(13, 0), LocalTime.of(15, 0));

        ordinary = lessonRepo.save(Lesson.of(LessonType.ORDINARY));
        masterClass = lessonRepo.save(Lesson.of(LessonType.MASTER_CLASS));
    }

    @AfterEach
    void cleanUp() {
        entitlementRepo.deleteAllInBatch();
        entryRepo.deleteAllInBatch();
        workingHoursRepo.deleteAllInBatch();
        lessonRepo.deleteAllInBatch();
        customerRepo.deleteAllInBatch();
        teacherRepo.deleteAllInBatch();
    }

    // ---------- Helpers ----------
    private LessonEntitlement buy(String customerName, Lesson lesson) {
        Customer c = customerService.register(customerName, "Customer", customerName.toLowerCase() + "@example.com");
        return entitlementService.buySingle(c, lesson, new BigDecimal("10.00"));
    }

    private LocalDateTime at(int hour, int minute) {
        return monday.atTime(hour, minute);
    }

    private Lesson masterClassWithSeats(int seats) {
        Lesson lesson = Lesson.of(LessonType.MASTER_CLASS);
        lesson.setSlots(seats);
        return lessonRepo.save(lesson);
    }

    private CalendarEntry reload(CalendarEntry entry) {
        return entryRepo.findById(entry.getId()).orElseThrow();
    }

    private List<CalendarEntry> entriesOnMonday() {
        return entryRepo.findByTeacherAndStartLessThanAndEndGreaterThanOrderByStartAsc(
                teacher, monday.plusDays(1).atStartOfDay(), monday.atStartOfDay());
    }

    // Starts both tasks at once and returns what they threw
    private List<Throwable> runTogether(Callable<?> first, Callable<?> second) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch ready = new CountDownLatch(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Object>> futures = new ArrayList<>();
            for (Callable<?> task : List.of(first, second)) {
                futures.add(pool.submit(() -> {
                    ready.countDown();
                    go.await();
                    return task.call();
                }));
            }
            ready.await(5, TimeUnit.SECONDS);
            go.countDown();

            List<Throwable> failures = new ArrayList<>();
            for (Future<Object> f : futures) {
                try {
                    f.get(30, TimeUnit.SECONDS);
                } catch (ExecutionException e) {
                    failures.add(e.getCause());
                }
            }
            return failures;
        } finally {
            pool.shutdownNow();
        }
    }

    // ---------- Tests ----------

    @Test
    void schedule_withoutCallerTransaction_storesEntryAndSeat() {
        LessonEntitlement c = buy("Anna", ordinary);

        LessonEntitlement scheduled = schedulingService.schedule(c, teacher, at(13, 0));

        LessonEntitlement stored = entitlementRepo.findById(scheduled.getId()).orElseThrow();
        assertThat(stored.isScheduled()).isTrue();
        List<CalendarEntry> entries = entriesOnMonday();
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).getTakenSlots()).isEqualTo(1);
        assertThat(entries.get(0).isFree()).isFalse();
    }

    @Test
    void assign_entriesFromFreeEntryListing_countsEverySeat() {
        entryRepo.save(CalendarEntry.forLesson(teacher, masterClass, at(13, 0)));

        for (String name : List.of("Anna", "Boris")) {
            CalendarEntry entry = freeSlotService.findFreeEntries(teacher, monday, LessonType.MASTER_CLASS).get(0);
            schedulingService.assign(buy(name, masterClass), entry);
        }

        CalendarEntry entry = entriesOnMonday().get(0);
        assertThat(entry.getTakenSlots()).isEqualTo(2);
        assertThat(entitlementRepo.countByCalendarEntryId(entry.getId())).isEqualTo(2);
    }

    @Test
    void assign_staleEntry_isRejectedWhenNoSeatIsLeft() {
        CalendarEntry entry = entryRepo.save(CalendarEntry.forLesson(teacher, masterClassWithSeats(1), at(13, 0)));
        Lesson lesson = entry.getLesson();

        schedulingService.assign(buy("Anna", lesson), entry);

        // the caller's copy still shows the seat as free
        assertThat(entry.getTakenSlots()).isZero();
        LessonEntitlement late = buy("Boris", lesson);
        assertThatThrownBy(() -> schedulingService.assign(late, entry))
                .isInstanceOf(CannotBeScheduledException.class)
                .hasMessageContaining("not free")
                .hasMessageContaining("Boris Customer");
        assertThat(entitlementRepo.findById(late.getId()).orElseThrow().isScheduled()).isFalse();
        assertThat(reload(entry).getTakenSlots()).isEqualTo(1);
    }

    @Test
    void unschedule_loadedLesson_freesTheSeat() {
        LessonEntitlement scheduled = schedulingService.schedule(buy("Anna", ordinary), teacher, at(13, 0));
        LessonEntitlement loaded = entitlementRepo.findById(scheduled.getId()).orElseThrow();

        LessonEntitlement back = schedulingService.unschedule(loaded);

        assertThat(back.isScheduled()).isFalse();
        assertThat(entitlementRepo.findById(back.getId()).orElseThrow().isAvailable()).isTrue();
        CalendarEntry entry = entriesOnMonday().get(0);
        assertThat(entry.getTakenSlots()).isZero();
        assertThat(entry.isFree()).isTrue();
    }

    @Test
    void directSave_clearingEntry_givesTheSeatBack() {
        LessonEntitlement c = buy("Anna", ordinary);
        c.setCalendarEntry(CalendarEntry.forLesson(teacher, ordinary, at(13, 0)));
        LessonEntitlement saved = entitlementService.save(c);
        CalendarEntry entry = entriesOnMonday().get(0);
        assertThat(entry.getTakenSlots()).isEqualTo(1);

        saved.setCalendarEntry(null);
        entitlementService.save(saved);

        CalendarEntry after = reload(entry);
        assertThat(after.getTakenSlots()).isZero();
        assertThat(after.isFree()).isTrue();
        assertThat(entitlementRepo.countByCalendarEntryId(entry.getId())).isZero();
        assertThat(entitlementRepo.findById(saved.getId()).orElseThrow().isScheduled()).isFalse();
    }

    @Test
    void schedule_failingSeatUpdate_rollsBackEntryAndLesson() {
        LessonEntitlement c = buy("Anna", ordinary);
        doThrow(new IllegalStateException("seat update failed"))
                .when(calendarEntryService).recountSeats(any(CalendarEntry.class));

        assertThatThrownBy(() -> schedulingService.schedule(c, teacher, at(13, 0)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("seat update failed");

        assertThat(entriesOnMonday()).isEmpty();
        LessonEntitlement stored = entitlementRepo.findById(c.getId()).orElseThrow();
        assertThat(stored.isScheduled()).isFalse();
        assertThat(stored.getCalendarEntry()).isNull();
    }

    @Test
    void concurrentAssigns_forLastSeat_onlyOneWins() throws Exception {
        Lesson lesson = masterClassWithSeats(2);
        CalendarEntry entry = entryRepo.save(CalendarEntry.forLesson(teacher, lesson, at(13, 0)));
        schedulingService.assign(buy("Anna", lesson), entry);
        LessonEntitlement boris = buy("Boris", lesson);
        LessonEntitlement clara = buy("Clara", lesson);

        List<Throwable> failures = runTogether(
                () -> schedulingService.assign(boris, entry),
                () -> schedulingService.assign(clara, entry));

        assertThat(failures).hasSize(1);
        assertThat(failures.get(0)).isInstanceOf(CannotBeScheduledException.class);
        assertThat(reload(entry).getTakenSlots()).isEqualTo(2);
        assertThat(entitlementRepo.countByCalendarEntryId(entry.getId())).isEqualTo(2);
    }

    @Test
    void concurrentSchedules_forOverlappingTime_onlyOneWins() throws Exception {
        LessonEntitlement anna = buy("Anna", ordinary);
        LessonEntitlement boris = buy("Boris", ordinary);

        List<Throwable> failures = runTogether(
                () -> schedulingService.schedule(anna, teacher, at(13, 0), false, false),
                () -> schedulingService.schedule(boris, teacher, at(13, 15), false, false));

        assertThat(failures).hasSize(1);
        assertThat(failures.get(0))
                .isInstanceOf(CannotBeScheduledException.class)
                .hasMessageContaining("not free");
        assertThat(entriesOnMonday()).hasSize(1);
    }

    @Test
    void findFreeTeachers_withoutCallerTransaction() {
        assertThat(availabilityService.findFreeTeachers(monday)).extracting(Teacher::getId).containsExactly(teacher.getId());
        assertThat(availabilityService.findFreeTeachers(monday.plusDays(2))).isEmpty();
    }
}
