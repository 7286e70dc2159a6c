package com.yhy.extrusion.service.strategy;

import com.yhy.extrusion.heuristic.BestFitDecreasingPacker;
import com.yhy.extrusion.vo.AlgorithmMode;
import org.springframework.stereotype.Service;

@Service
public class BfdStrategy extends HeuristicStrategy {

    public BfdStrategy() {
        super(new BestFitDecreasingPacker());
    }

    @Override
    public AlgorithmMode getMode() {
        return AlgorithmMode.BFD;
    }
}
