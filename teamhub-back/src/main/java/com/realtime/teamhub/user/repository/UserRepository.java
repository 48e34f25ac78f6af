package com.realtime.teamhub.user.repository;

import com.realtime.teamhub.user.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface UserRepository extends JpaRepository<User, UUID> {
}
