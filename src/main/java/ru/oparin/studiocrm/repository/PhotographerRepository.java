package ru.oparin.studiocrm.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import ru.oparin.studiocrm.model.entity.Photographer;

public interface PhotographerRepository extends ReactiveCrudRepository<Photographer, String> {

    Flux<Photographer> findAllByOrderByCreatedAtDesc();
}
