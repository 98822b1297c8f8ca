package com.health.consult.repository;

import com.health.consult.entity.Question;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface QuestionRepository extends JpaRepository<Question, Long> {

    List<Question> findByConditionIdOrderByOrderIndexAsc(String conditionId);

    boolean existsByConditionId(String conditionId);
}
