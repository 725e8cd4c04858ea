package ru.oparin.studiocrm.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;
import ru.oparin.studiocrm.model.entity.User;
import ru.oparin.studiocrm.model.enums.Role;

public interface UserRepository extends ReactiveCrudRepository<User, String> {

    Mono<User> findByEmailAndRole(String email, Role role);
    Mono<User> findByEmailAndRoleAndPhotographerId(String email, Role role, String photographerId);
    Mono<User> findFirstByPhotographerIdAndRole(String photographerId, Role role);
    Mono<Boolean> existsByEmailAndRole(String email, Role role);
}
