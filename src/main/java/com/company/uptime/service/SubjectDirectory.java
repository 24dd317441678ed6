package com.company.uptime.service;

import com.company.uptime.domain.Domain;
import com.company.uptime.domain.Subject;
import com.company.uptime.domain.SubjectRef;
import com.company.uptime.repository.DomainRepository;
import com.company.uptime.repository.MonitorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only view over monitors and domains as schedulable subjects.
 */
@Service
@RequiredArgsConstructor
public class SubjectDirectory {

    /** Creation time, then subject key. */
    public static final Comparator<Subject> CREATION_ORDER = Comparator
            .comparing(Subject::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Subject::getRef);

    private final MonitorRepository monitorRepository;
    private final DomainRepository domainRepository;

    public Optional<Subject> find(SubjectRef ref) {
        switch (ref.getType()) {
            case MONITOR:
                return monitorRepository.findById(ref.getId()).map(Subject.class::cast);
            case DOMAIN:
                return domainRepository.findByName(ref.getId()).map(Subject.class::cast);
            default:
                return Optional.empty();
        }
    }

    public List<Subject> findAllActive() {
        List<Subject> subjects = new ArrayList<>();
        subjects.addAll(monitorRepository.findAllActive());
        subjects.addAll(domainRepository.findAllActive());
        subjects.sort(CREATION_ORDER);
        return subjects;
    }

    /**
     * Active domains owned by {@code userId}, in creation order.
     */
    public List<Subject> findActiveDomains(String userId) {
        return domainRepository.findByUserId(userId).stream()
                .filter(Domain::isEnabled)
                .sorted(CREATION_ORDER)
                .map(Subject.class::cast)
                .collect(Collectors.toList());
    }
}
