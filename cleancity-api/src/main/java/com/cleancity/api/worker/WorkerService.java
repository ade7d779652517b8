package com.cleancity.api.worker;

import com.cleancity.api.error.NotFoundException;
import com.cleancity.api.error.ValidationException;
import com.cleancity.core.domain.Worker;
import com.cleancity.core.repository.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Registry of sanitation workers and the zones they cover.
 */
@Service
public class WorkerService {

    private static final Logger log = LoggerFactory.getLogger(WorkerService.class);
    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9]{10,15}$");

    private final WorkerRepository workerRepository;
    private final Clock clock;

    public WorkerService(WorkerRepository workerRepository, Clock clock) {
        this.workerRepository = workerRepository;
        this.clock = clock;
    }

    @Transactional
    public WorkerDto register(String name, String phone, Set<String> zones) {
        if (name == null || name.isBlank() || name.trim().length() > 100) {
            throw new ValidationException("name", "Name is required and must be at most 100 characters");
        }
        if (phone == null || !PHONE.matcher(phone).matches()) {
            throw new ValidationException("phone", "Phone number must have 10 to 15 digits");
        }
        if (workerRepository.existsByPhone(phone)) {
            throw new ValidationException("phone", "A worker with this phone number already exists");
        }
        Worker worker = workerRepository.save(Worker.create(name.trim(), phone,
                zones == null ? Set.of() : zones, clock.instant()));
        log.info("Registered worker id={} zones={}", worker.getId(), worker.getAssignedZones());
        return toDto(worker);
    }

    @Transactional
    public WorkerDto deactivate(UUID workerId) {
        Worker worker = workerRepository.findById(workerId)
                .orElseThrow(() -> new NotFoundException("Worker not found: " + workerId));
        worker.deactivate();
        log.info("Deactivated worker id={}", workerId);
        return toDto(workerRepository.save(worker));
    }

    /**
     * Active worker or NOT_FOUND; inactive workers cannot take new work.
     */
    @Transactional(readOnly = true)
    public Worker requireActiveWorker(UUID workerId) {
        return workerRepository.findById(workerId)
                .filter(Worker::isActive)
                .orElseThrow(() -> new NotFoundException("Active worker not found: " + workerId));
    }

    @Transactional(readOnly = true)
    public List<WorkerDto> listWorkers() {
        return workerRepository.findAll().stream().map(this::toDto).toList();
    }

    private WorkerDto toDto(Worker worker) {
        return new WorkerDto(worker.getId(), worker.getName(), worker.getPhone(),
                Set.copyOf(worker.getAssignedZones()), worker.isActive());
    }

    public record WorkerDto(UUID id, String name, String phone, Set<String> zones, boolean active) {}
}
